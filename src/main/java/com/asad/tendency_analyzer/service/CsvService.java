package com.asad.tendency_analyzer.service;

import com.asad.tendency_analyzer.model.PlayRecord;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the PFF play feed. Columns are looked up by header name so their order in
 * the file doesn't matter; unknown columns are ignored.
 */
@Service
public class CsvService {

    static final String RUNPASS = "pff_RUNPASS";
    static final String OFFTEAM = "pff_OFFTEAM";
    static final String DEFTEAM = "pff_DEFTEAM";
    static final String WEEK = "pff_WEEK";
    static final String QUARTER = "pff_QUARTER";
    static final String DOWN = "pff_DOWN";
    static final String DISTANCE = "pff_DISTANCE";
    static final String YARDS_TO_GOAL = "pff_YARDS_TO_GOAL_LINE";
    static final String CLOCK = "pff_CLOCK";
    static final String RUN_CONCEPT = "pff_RUNCONCEPTPRIMARY";
    static final String DROPBACK_TYPE = "pff_DROPBACKTYPE";
    static final String PLAY_ACTION = "pff_PLAYACTION";
    static final String OFF_PERSONNEL = "pff_OFF_PERSONNEL_GROUP";
    static final String OFF_FORMATION = "pff_OFFFORMATIONGROUP";
    static final String SHOTGUN = "pff_SHOTGUN";
    static final String SHIFT_MOTION = "pff_SHIFTMOTION";
    static final String DEF_PACKAGE = "pff_DEF_PACKAGE";
    static final String BLITZ_DOG = "pff_BLITZDOG";
    static final String PASS_RUSHERS = "pff_PASSRUSHPLAYERS";
    static final String COVERAGE = "pff_PASS_COVERAGE_BASIC";
    static final String MOFO_SHOWN = "pff_MOFOCSHOWN";
    static final String MOFO_PLAYED = "pff_MOFOCPLAYED";

    static final List<String> REQUIRED_COLUMNS = List.of(
            RUNPASS, OFFTEAM, DEFTEAM, WEEK, QUARTER, DOWN, DISTANCE, YARDS_TO_GOAL, CLOCK,
            RUN_CONCEPT, DROPBACK_TYPE, PLAY_ACTION, OFF_PERSONNEL, OFF_FORMATION, SHOTGUN,
            SHIFT_MOTION, DEF_PACKAGE, BLITZ_DOG, PASS_RUSHERS, COVERAGE, MOFO_SHOWN, MOFO_PLAYED);

    public List<PlayRecord> load(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (NoSuchFileException ex) {
            throw new PlayDataException("Play data file not found: " + path, ex);
        } catch (IOException ex) {
            throw new PlayDataException("Could not read play data " + path + ": " + ex.getMessage(), ex);
        }
    }

    public List<PlayRecord> read(Reader source, String sourceName) {
        List<PlayRecord> records = new ArrayList<>();

        try (CSVReader reader = new CSVReader(source)) {
            String[] header = reader.readNext();
            if (header == null) {
                throw new PlayDataException(sourceName + " is empty");
            }
            Columns cols = new Columns(header, sourceName);

            String[] row;
            int line = 1;
            while ((row = reader.readNext()) != null) {
                line++;
                if (row.length == 1 && row[0].isBlank()) continue;
                records.add(toRecord(cols, row, line));
            }
        } catch (IOException | CsvValidationException ex) {
            throw new PlayDataException("CSV parse failed for " + sourceName + ": " + ex.getMessage(), ex);
        }

        return records;
    }

    /** Drops everything that isn't a run or a pass (special teams, kneels, spikes...). */
    public List<PlayRecord> clean(List<PlayRecord> records) {
        List<PlayRecord> out = new ArrayList<>();
        for (PlayRecord r : records) {
            if (r.isRunOrPass()) out.add(r);
        }
        return out;
    }

    private PlayRecord toRecord(Columns c, String[] row, int line) {
        PlayRecord r = new PlayRecord();
        r.runPass = c.text(row, RUNPASS);
        r.offTeam = c.text(row, OFFTEAM);
        r.defTeam = c.text(row, DEFTEAM);
        r.week = c.text(row, WEEK);

        // rows clean() will drop are read leniently: an odd cell there can't fail the load
        boolean strict = r.isRunOrPass();

        r.quarter = c.integer(row, QUARTER, line, strict);
        r.down = c.integer(row, DOWN, line, strict);
        r.distance = c.integer(row, DISTANCE, line, strict);
        r.yardsToGoal = c.integer(row, YARDS_TO_GOAL, line, strict);
        r.clock = c.text(row, CLOCK);

        r.runConcept = c.text(row, RUN_CONCEPT);
        r.dropbackType = c.text(row, DROPBACK_TYPE);
        r.playAction = c.integer(row, PLAY_ACTION, line, strict);

        r.offPersonnel = c.text(row, OFF_PERSONNEL);
        r.offFormation = c.text(row, OFF_FORMATION);
        r.shotgun = c.text(row, SHOTGUN);
        r.shiftMotion = c.text(row, SHIFT_MOTION);

        r.defPackage = c.text(row, DEF_PACKAGE);
        r.blitzDog = c.integer(row, BLITZ_DOG, line, strict);
        r.passRushPlayers = c.text(row, PASS_RUSHERS);
        r.coverageBasic = c.text(row, COVERAGE);
        r.mofoShown = c.text(row, MOFO_SHOWN);
        r.mofoPlayed = c.text(row, MOFO_PLAYED);
        return r;
    }

    private static final class Columns {
        private final Map<String, Integer> index = new HashMap<>();

        Columns(String[] header, String sourceName) {
            for (int i = 0; i < header.length; i++) {
                String name = header[i].trim();
                // BOM on the first header cell
                if (i == 0 && name.startsWith("\uFEFF")) name = name.substring(1);
                index.putIfAbsent(name, i);
            }
            List<String> missing = new ArrayList<>();
            for (String col : REQUIRED_COLUMNS) {
                if (!index.containsKey(col)) missing.add(col);
            }
            if (!missing.isEmpty()) {
                throw new PlayDataException(sourceName + " is missing required column(s): " + missing);
            }
        }

        String text(String[] row, String column) {
            int i = index.get(column);
            if (i >= row.length) return null;
            String v = row[i].trim();
            return v.isEmpty() ? null : v;
        }

        Integer integer(String[] row, String column, int line, boolean strict) {
            String v = text(row, column);
            if (v == null) return null;
            try {
                return Integer.parseInt(v);
            } catch (NumberFormatException notInt) {
                // pandas-style exports write nullable integer columns as "3.0"
                Integer whole = wholeNumber(v);
                if (whole != null || !strict) return whole;
                throw new PlayDataException("Line " + line + ": column " + column + " is not a number: '" + v + "'");
            }
        }

        private static Integer wholeNumber(String v) {
            try {
                double d = Double.parseDouble(v);
                if (Double.isInfinite(d) || d != Math.rint(d)) return null;
                return (int) d;
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
