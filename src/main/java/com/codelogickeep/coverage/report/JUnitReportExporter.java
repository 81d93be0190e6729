package com.codelogickeep.coverage.report;

import com.codelogickeep.coverage.model.CiRunResult;
import com.codelogickeep.coverage.model.CiRunResult.GateOutcome;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes quality gate outcomes as a JUnit XML test suite so CI servers can show them
 * next to ordinary test results.
 */
public class JUnitReportExporter {

    static final String SUITE_NAME = "Coverage Analysis";
    static final String CLASS_NAME = "CoverageAnalysis";

    public void export(CiRunResult result, Path outputFile) throws IOException {
        List<GateOutcome> outcomes = result.qualityGates() != null
                ? result.qualityGates().results()
                : List.of();
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            Element suite = doc.createElement("testsuite");
            suite.setAttribute("name", SUITE_NAME);
            suite.setAttribute("tests", String.valueOf(outcomes.size()));
            suite.setAttribute("failures", String.valueOf(outcomes.stream().filter(o -> !o.passed()).count()));
            suite.setAttribute("time", "0");
            doc.appendChild(suite);

            for (GateOutcome outcome : outcomes) {
                Element testcase = doc.createElement("testcase");
                testcase.setAttribute("name", "QualityGate." + outcome.name());
                testcase.setAttribute("classname", CLASS_NAME);
                if (!outcome.passed()) {
                    Element failure = doc.createElement("failure");
                    failure.setAttribute("message", outcome.message());
                    failure.setTextContent(outcome.message());
                    testcase.appendChild(failure);
                }
                suite.appendChild(testcase);
            }

            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "4");
            transformer.transform(new DOMSource(doc), new StreamResult(outputFile.toFile()));
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IOException("Failed to write JUnit XML to " + outputFile + ": " + e.getMessage(), e);
        }
    }
}
