package com.bidradar.crawl.service;

import com.bidradar.config.CrawlerProperties;
import com.bidradar.crawl.model.IngestionRunSummary;
import com.bidradar.crawl.model.SelectorTestReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

@Component
public class IngestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(IngestCliRunner.class);

    static final String MODE_INGEST = "ingest";
    static final String MODE_TEST_SOURCE = "test-source";

    private final CrawlerProperties properties;
    private final IngestionDriverService ingestionDriverService;
    private final SelectorTestService selectorTestService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public IngestCliRunner(
        CrawlerProperties properties,
        IngestionDriverService ingestionDriverService,
        SelectorTestService selectorTestService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.ingestionDriverService = ingestionDriverService;
        this.selectorTestService = selectorTestService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!properties.getCli().isRun()) {
            return;
        }

        String mode = properties.getCli().getMode() == null
            ? MODE_INGEST
            : properties.getCli().getMode().trim().toLowerCase(Locale.ROOT);
        int exitCode = switch (mode) {
            case MODE_INGEST -> runIngest();
            case MODE_TEST_SOURCE -> runSelectorTest();
            default -> {
                log.error("Unknown bidradar.cli.mode '{}'; expected {} or {}", mode, MODE_INGEST, MODE_TEST_SOURCE);
                yield 2;
            }
        };

        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int runIngest() {
        IngestionRunSummary summary = ingestionDriverService.runOnce();
        log.info("Appended {} new opportunity record(s)", summary.newRecordsAppended());
        return 0;
    }

    int runSelectorTest() throws IOException {
        String sourceId = properties.getCli().getTestSource();
        if (sourceId == null || sourceId.isBlank()) {
            log.error("bidradar.cli.test-source is required in {} mode", MODE_TEST_SOURCE);
            return 2;
        }
        SelectorTestReport report;
        try {
            report = selectorTestService.test(sourceId.trim(), properties.getCli().getLimit(), properties.getCli().isFetchDetails());
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return 2;
        }

        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        String out = properties.getCli().getOut();
        if (out == null || out.isBlank()) {
            System.out.println(json);
        } else {
            Path path = Paths.get(out.trim());
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, json, StandardCharsets.UTF_8);
            log.info("Results written to {}", path);
        }
        return 0;
    }
}
