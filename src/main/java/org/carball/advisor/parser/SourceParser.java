package org.carball.advisor.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Turns Java source text into a syntax tree. A fresh {@link JavaParser} is
 * created per call because parser instances are not thread-safe.
 */
@Slf4j
public class SourceParser {

    private final ParserConfiguration configuration;

    public SourceParser() {
        this(ParserConfiguration.LanguageLevel.JAVA_17);
    }

    public SourceParser(ParserConfiguration.LanguageLevel languageLevel) {
        this.configuration = new ParserConfiguration().setLanguageLevel(languageLevel);
    }

    public Optional<CompilationUnit> parse(String source, String filePath) {
        ParseResult<CompilationUnit> result = new JavaParser(configuration).parse(source);

        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult();
        }

        log.debug("Skipping {}: {} parse problem(s), first: {}", filePath, result.getProblems().size(),
                result.getProblems().isEmpty() ? "unknown" : result.getProblems().get(0).getMessage());
        return Optional.empty();
    }
}
