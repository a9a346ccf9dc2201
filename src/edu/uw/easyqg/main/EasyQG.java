package edu.uw.easyqg.main;

import com.google.common.collect.ImmutableList;
import edu.uw.easyqg.annotation.Annotator;
import edu.uw.easyqg.annotation.SharedAnnotator;
import edu.uw.easyqg.qg.QuestionGenerator;
import org.kohsuke.args4j.CmdLineException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Prints the questions generated from each passage, one per line.
 * Usage: EasyQG [-input FILE] [-missing_object_wh WHY|WHAT] [-max_chars N] [text ...]
 */
public class EasyQG {
    private static final Logger log = LoggerFactory.getLogger(EasyQG.class);

    public static void main(final String[] args) throws IOException {
        final QuestionGenerationConfig config;
        try {
            config = new QuestionGenerationConfig(args);
        } catch (final CmdLineException e) {
            System.err.println(e.getMessage());
            new QuestionGenerationConfig().printUsage(System.err);
            System.exit(1);
            return;
        }
        if (config.help || (config.inputFile == null && config.text.isEmpty())) {
            config.printUsage(System.err);
            System.exit(config.help ? 0 : 1);
            return;
        }
        System.err.println("====Starting loading model====");
        final Annotator annotator = SharedAnnotator.coreNlp(config.getCoreNlpProperties());
        run(config, annotator, System.out);
    }

    static void run(final QuestionGenerationConfig config, final Annotator annotator, final PrintStream out)
            throws IOException {
        final ImmutableList<String> passages;
        if (config.inputFile != null) {
            try (BufferedReader reader = Files.newBufferedReader(Paths.get(config.inputFile), StandardCharsets.UTF_8)) {
                passages = readPassages(reader);
            }
        } else {
            passages = ImmutableList.of(config.getText());
        }
        for (String passage : passages) {
            if (passage.length() > config.maxChars) {
                log.warn("Skipping passage of {} characters (limit {})", passage.length(), config.maxChars);
                continue;
            }
            QuestionGenerator.fromText(annotator, passage, config.missingObjectWh)
                    .getQuestionStrings()
                    .forEach(out::println);
        }
    }

    /**
     * Passages are separated by blank lines; the lines of one passage are joined with spaces.
     */
    static ImmutableList<String> readPassages(final BufferedReader reader) throws IOException {
        final ImmutableList.Builder<String> passages = ImmutableList.builder();
        String buffer = "";
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.trim().isEmpty()) {
                if (!buffer.isEmpty()) {
                    passages.add(buffer);
                    buffer = "";
                }
            } else {
                buffer += (buffer.isEmpty() ? "" : " ") + line.trim();
            }
        }
        if (!buffer.isEmpty()) {
            passages.add(buffer);
        }
        return passages.build();
    }
}
