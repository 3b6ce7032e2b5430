package com.mainframe.transpiler.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.transpiler.lexer.CobolLineReader;
import com.mainframe.transpiler.lexer.CobolTokenizer;
import com.mainframe.transpiler.lexer.CopyMemberResolver;
import com.mainframe.transpiler.lexer.ExpandedSource;
import com.mainframe.transpiler.lexer.SourceFormat;
import com.mainframe.transpiler.lexer.SourceLine;
import com.mainframe.transpiler.lexer.TokenizeResult;

/**
 * Runs the front end for one program: line reading, COPY expansion, tokenizing and parsing.
 */
public class CobolSourceParser {
    private static final Logger log = LoggerFactory.getLogger(CobolSourceParser.class);

    private final SourceFormat format;
    private final int rightMargin;
    private final List<Path> copybookDirs;

    public CobolSourceParser(SourceFormat format, int rightMargin, List<Path> copybookDirs) {
        this.format = format;
        this.rightMargin = rightMargin;
        this.copybookDirs = copybookDirs != null ? copybookDirs : List.of();
    }

    public CobolSourceParser() {
        this(SourceFormat.FIXED, SourceFormat.DEFAULT_FIXED_MARGIN, List.of());
    }

    public ParseResult parse(Path file) throws IOException {
        String content = Files.readString(file);
        Path dir = file.toAbsolutePath().getParent();
        return parse(content, file.getFileName().toString(), dir);
    }

    /**
     * @param baseDir directory searched first for COPY members; may be null
     */
    public ParseResult parse(String content, String fileName, Path baseDir) {
        log.info("Parsing program: {}", fileName);

        CobolLineReader reader = new CobolLineReader(format, rightMargin);
        List<SourceLine> lines = reader.read(content, fileName);

        CopyMemberResolver resolver = new CopyMemberResolver(baseDir, copybookDirs, reader);
        ExpandedSource expanded = resolver.expand(lines);

        int contentWidth = format == SourceFormat.FIXED ? reader.contentWidth() : 0;
        TokenizeResult tokens = new CobolTokenizer(expanded.getLines(), contentWidth).tokenize();

        ParseResult result = new CobolParser(tokens.getTokens(), fileName).parse();
        return result.withCopyDiagnostics(tokens.getErrors(), expanded.getUnresolved());
    }
}
