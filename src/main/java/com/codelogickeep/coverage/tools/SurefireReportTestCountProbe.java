package com.codelogickeep.coverage.tools;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Sums the {@code tests} attribute over Surefire's {@code TEST-*.xml} reports.
 */
public class SurefireReportTestCountProbe implements TestCountProbe {
    private static final Logger log = LoggerFactory.getLogger(SurefireReportTestCountProbe.class);

    private final Path reportsDir;

    public SurefireReportTestCountProbe(Path reportsDir) {
        this.reportsDir = reportsDir;
    }

    @Override
    public int count() {
        if (!Files.isDirectory(reportsDir)) {
            log.debug("No surefire reports at {}", reportsDir);
            return 0;
        }

        List<Path> reports;
        try (Stream<Path> stream = Files.list(reportsDir)) {
            reports = stream
                    .filter(p -> p.getFileName().toString().startsWith("TEST-"))
                    .filter(p -> p.getFileName().toString().endsWith(".xml"))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list surefire reports in {}: {}", reportsDir, e.getMessage());
            return 0;
        }

        int totalTests = 0;
        for (Path report : reports) {
            try {
                DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
                factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
                DocumentBuilder builder = factory.newDocumentBuilder();
                Document doc = builder.parse(report.toFile());
                Element root = doc.getDocumentElement();
                String tests = root.getAttribute("tests");
                if (!tests.isEmpty()) {
                    totalTests += Integer.parseInt(tests);
                }
            } catch (Exception e) {
                log.warn("Skipping unreadable surefire report {}: {}", report.getFileName(), e.getMessage());
            }
        }
        return totalTests;
    }
}
