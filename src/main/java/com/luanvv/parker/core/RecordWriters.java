package com.luanvv.parker.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.luanvv.parker.model.CandidateRecord;
import com.luanvv.parker.model.Submission;
import com.luanvv.parker.model.TimelineEntry;
import com.opencsv.CSVWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RecordWriters {
    private final Path baseDir;
    private final boolean jsonEnabled;
    private final boolean csvEnabled;
    private final ObjectMapper objectMapper;

    public RecordWriters(Config.Output cfg) throws IOException {
        this.baseDir = Path.of(cfg.getDir());
        this.jsonEnabled = cfg.isJson();
        this.csvEnabled = cfg.isCsv();
        if (cfg.isEnabled()) {
            Files.createDirectories(baseDir);
        }
        this.objectMapper = jsonMapper();
    }

    public static ObjectMapper jsonMapper() {
        return new ObjectMapper()
            .registerModule(new Jdk8Module())
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(CandidateRecord candidate) {
        String name = "candidate_" + candidate.id();
        if (jsonEnabled) writeJson(baseDir.resolve(name + ".json"), candidate);
        if (csvEnabled) writeCsv(baseDir.resolve(name + ".csv"), flatten(candidate));
    }

    private void writeJson(Path path, CandidateRecord candidate) {
        try {
            objectMapper.writeValue(path.toFile(), candidate);
            log.debug("Wrote JSON {}", path);
        } catch (IOException e) {
            log.error("Failed to write JSON {}", path, e);
        }
    }

    private void writeCsv(Path path, Map<String, String> row) {
        try (Writer w = Files.newBufferedWriter(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
             CSVWriter csv = new CSVWriter(w)) {
            csv.writeNext(row.keySet().toArray(String[]::new));
            csv.writeNext(row.values().toArray(String[]::new));
            log.debug("Wrote CSV {}", path);
        } catch (IOException e) {
            log.error("Failed to write CSV {}", path, e);
        }
    }

    /** One CSV row per candidate; the timeline becomes a column per milestone. */
    static Map<String, String> flatten(CandidateRecord candidate) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("id", candidate.id());
        row.put("url", candidate.url());
        row.put("name", candidate.name());
        row.put("current_owner", candidate.currentOwner().orElse(""));
        row.put("sourced_by", candidate.sourcedBy().orElse(""));
        row.put("location", candidate.location().orElse(""));
        row.put("linkedin_url", candidate.linkedinUrl().orElse(""));
        for (TimelineEntry entry : candidate.timeline()) {
            row.put(entry.label(), entry.date());
        }
        row.put("submissions", candidate.submissions().stream()
            .map(RecordWriters::describe)
            .collect(Collectors.joining("|")));
        return row;
    }

    private static String describe(Submission s) {
        return String.join(" / ", s.role(), s.company(), s.stage(), s.dates(), s.owner());
    }
}
