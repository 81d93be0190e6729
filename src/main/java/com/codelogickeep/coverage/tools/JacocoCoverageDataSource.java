package com.codelogickeep.coverage.tools;

import com.codelogickeep.coverage.exception.CoverageGateException;
import com.codelogickeep.coverage.model.FileCoverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Reads line and branch counters from a JaCoCo XML report.
 * <p>
 * Each {@code <sourcefile>} is resolved against the source root using its package
 * directory. A line with covered instructions ({@code ci > 0}) counts as executed,
 * a line with only missed instructions as missing. Branch arcs are {@code cb} covered
 * and {@code mb} missed.
 */
public class JacocoCoverageDataSource implements CoverageDataSource {
    private static final Logger log = LoggerFactory.getLogger(JacocoCoverageDataSource.class);

    private final Path reportFile;
    private final Path sourceRoot;

    public JacocoCoverageDataSource(Path reportFile, Path sourceRoot) {
        this.reportFile = reportFile;
        this.sourceRoot = sourceRoot;
    }

    @Override
    public List<FileCoverage> read() {
        File xmlFile = reportFile.toFile();
        if (!Files.isRegularFile(reportFile)) {
            throw new CoverageGateException(CoverageGateException.ErrorCode.COVERAGE_REPORT_NOT_FOUND,
                    "Coverage report not found at " + reportFile.toAbsolutePath(), describe());
        }

        Document doc;
        try {
            doc = parseXml(xmlFile);
        } catch (Exception e) {
            throw new CoverageGateException(CoverageGateException.ErrorCode.COVERAGE_PARSE_ERROR,
                    "Failed to parse coverage report: " + e.getMessage(), describe(), e);
        }

        List<FileCoverage> files = new ArrayList<>();
        NodeList packages = doc.getElementsByTagName("package");
        for (int i = 0; i < packages.getLength(); i++) {
            Element pkg = (Element) packages.item(i);
            String packageDir = pkg.getAttribute("name");

            for (Element sourceFile : childElements(pkg, "sourcefile")) {
                files.add(readSourceFile(packageDir, sourceFile));
            }
        }

        log.debug("Read coverage of {} files from {}", files.size(), reportFile);
        return files;
    }

    @Override
    public String describe() {
        return "JaCoCo report " + reportFile;
    }

    private FileCoverage readSourceFile(String packageDir, Element sourceFile) {
        Path path = packageDir.isEmpty()
                ? sourceRoot.resolve(sourceFile.getAttribute("name"))
                : sourceRoot.resolve(packageDir).resolve(sourceFile.getAttribute("name"));

        SortedSet<Integer> executed = new TreeSet<>();
        SortedSet<Integer> missing = new TreeSet<>();
        int coveredBranches = 0;
        int missedBranches = 0;

        for (Element line : childElements(sourceFile, "line")) {
            int nr = intAttribute(line, "nr");
            int mi = intAttribute(line, "mi");
            int ci = intAttribute(line, "ci");
            if (ci > 0) {
                executed.add(nr);
            } else if (mi > 0) {
                missing.add(nr);
            }
            coveredBranches += intAttribute(line, "cb");
            missedBranches += intAttribute(line, "mb");
        }

        return new FileCoverage(path.normalize(), executed, missing, coveredBranches, missedBranches);
    }

    private static List<Element> childElements(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && tagName.equals(node.getNodeName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static int intAttribute(Element element, String name) {
        String value = element.getAttribute(name);
        return value.isEmpty() ? 0 : Integer.parseInt(value);
    }

    private Document parseXml(File xmlFile) throws Exception {
        DocumentBuilderFactory dbFactory = DocumentBuilderFactory.newInstance();
        // JaCoCo reports declare a DOCTYPE; allow it but never fetch the DTD
        dbFactory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", false);
        dbFactory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        dbFactory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        dbFactory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        DocumentBuilder dBuilder = dbFactory.newDocumentBuilder();
        Document doc = dBuilder.parse(xmlFile);
        doc.getDocumentElement().normalize();
        return doc;
    }
}
