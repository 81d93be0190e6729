package com.codelogickeep.coverage.tools;

import com.codelogickeep.coverage.exception.CoverageGateException;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parses Java sources into a {@link ScopeTree} of types and callables.
 */
public class SourceScopeParser {
    private static final Logger log = LoggerFactory.getLogger(SourceScopeParser.class);

    private final JavaParser parser;

    public SourceScopeParser() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
        this.parser = new JavaParser(configuration);
    }

    /**
     * @throws CoverageGateException {@code FILE_READ_FAILED} or {@code PARSE_ERROR}
     */
    public ScopeTree parse(Path sourceFile) {
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(sourceFile);
        } catch (IOException e) {
            throw new CoverageGateException(CoverageGateException.ErrorCode.FILE_READ_FAILED,
                    "Cannot read " + sourceFile + ": " + e.getMessage(), sourceFile.toString(), e);
        }
        return toTree(result, sourceFile.toString());
    }

    public ScopeTree parse(String source, String origin) {
        return toTree(parser.parse(source), origin);
    }

    private ScopeTree toTree(ParseResult<CompilationUnit> result, String origin) {
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(p -> p.getVerboseMessage())
                    .limit(3)
                    .collect(Collectors.joining("; "));
            throw new CoverageGateException(CoverageGateException.ErrorCode.PARSE_ERROR,
                    "Cannot parse " + origin + ": " + problems, origin);
        }

        CompilationUnit cu = result.getResult().get();
        List<ScopeNode> scopes = new ArrayList<>();

        for (TypeDeclaration<?> type : cu.findAll(TypeDeclaration.class)) {
            scopeOf(type, ScopeNode.Kind.CLASS, type.getNameAsString(), type.getName(), List.of())
                    .ifPresent(scopes::add);
        }
        for (CallableDeclaration<?> callable : cu.findAll(CallableDeclaration.class)) {
            List<String> parameters = new ArrayList<>();
            for (Parameter parameter : callable.getParameters()) {
                parameters.add(parameter.getNameAsString());
            }
            scopeOf(callable, ScopeNode.Kind.FUNCTION, callable.getNameAsString(), callable.getName(), parameters)
                    .ifPresent(scopes::add);
        }

        log.debug("Parsed {} scopes from {}", scopes.size(), origin);
        return new ScopeTree(scopes);
    }

    private static Optional<ScopeNode> scopeOf(Node node, ScopeNode.Kind kind, String name,
                                               Node nameNode, List<String> parameters) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty()) {
            return Optional.empty();
        }
        int declarationLine = nameNode.getBegin().map(p -> p.line).orElse(range.get().begin.line);
        Position begin = range.get().begin;
        Position end = range.get().end;
        return Optional.of(new ScopeNode(begin.line, end.line, kind, name, declarationLine, parameters));
    }
}
