package com.forex.service;

import com.forex.domain.vo.Tick;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 行情CSV读取器
 * <p>
 * 首行为表头，必须包含 timestamp,open,high,low,close，可选 testingGroups,validationGroups。
 * 字段可以带引号，表头前的 UTF-8 BOM 会被忽略。时间戳为秒级Unix时间。
 * </p>
 */
@Slf4j
@Component
public class TickCsvReader {

    private static final List<String> REQUIRED_COLUMNS =
            List.of(Tick.TIMESTAMP, Tick.OPEN, Tick.HIGH, Tick.LOW, Tick.CLOSE);

    private static final List<String> OPTIONAL_COLUMNS =
            List.of(Tick.TESTING_GROUPS, Tick.VALIDATION_GROUPS);

    private static final String BOM = "\uFEFF";

    public List<Tick> read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Tick> ticks = read(reader);
            log.info("读取CSV完成: file={}, ticks={}", file, ticks.size());
            return ticks;
        }
    }

    public List<Tick> read(Reader source) throws IOException {
        try (CSVReader reader = new CSVReader(source)) {
            String[] header = readRow(reader);
            if (header == null) {
                return List.of();
            }
            trim(header);
            if (header.length > 0 && header[0].startsWith(BOM)) {
                header[0] = header[0].substring(1);
            }

            int[] requiredIndexes = new int[REQUIRED_COLUMNS.size()];
            for (int i = 0; i < REQUIRED_COLUMNS.size(); i++) {
                requiredIndexes[i] = indexOf(header, REQUIRED_COLUMNS.get(i));
                if (requiredIndexes[i] < 0) {
                    throw new IOException("CSV缺少必需列: " + REQUIRED_COLUMNS.get(i));
                }
            }
            int[] optionalIndexes = new int[OPTIONAL_COLUMNS.size()];
            for (int i = 0; i < OPTIONAL_COLUMNS.size(); i++) {
                optionalIndexes[i] = indexOf(header, OPTIONAL_COLUMNS.get(i));
            }

            List<Tick> ticks = new ArrayList<>();
            String[] fields;
            while ((fields = readRow(reader)) != null) {
                trim(fields);
                if (fields.length == 1 && fields[0].isEmpty()) {
                    continue;
                }
                Tick tick = new Tick();
                try {
                    for (int i = 0; i < REQUIRED_COLUMNS.size(); i++) {
                        tick.put(REQUIRED_COLUMNS.get(i), parseField(fields, requiredIndexes[i]));
                    }
                    for (int i = 0; i < OPTIONAL_COLUMNS.size(); i++) {
                        if (optionalIndexes[i] >= 0 && optionalIndexes[i] < fields.length) {
                            tick.put(OPTIONAL_COLUMNS.get(i), parseField(fields, optionalIndexes[i]));
                        }
                    }
                } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    throw new IOException("CSV第" + reader.getLinesRead() + "行格式错误: "
                            + String.join(",", fields), e);
                }
                ticks.add(tick);
            }
            return ticks;
        }
    }

    private static String[] readRow(CSVReader reader) throws IOException {
        try {
            return reader.readNext();
        } catch (CsvValidationException e) {
            throw new IOException("CSV第" + reader.getLinesRead() + "行无法解析", e);
        }
    }

    private static void trim(String[] fields) {
        for (int i = 0; i < fields.length; i++) {
            fields[i] = fields[i].trim();
        }
    }

    private static int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (header[i].equals(column)) {
                return i;
            }
        }
        return -1;
    }

    private static double parseField(String[] fields, int index) {
        return Double.parseDouble(fields[index]);
    }
}
