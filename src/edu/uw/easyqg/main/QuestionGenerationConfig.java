package edu.uw.easyqg.main;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import edu.uw.easyqg.qg.WhWord;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Options shared by the command line and the HTTP server. Defaults come from easyqg.properties on the classpath;
 * command-line options override them.
 */
public class QuestionGenerationConfig {
    static final String DEFAULTS_RESOURCE = "/easyqg.properties";
    static final String CORENLP_RESOURCE = "/corenlp.properties";
    static final ImmutableSet<WhWord> missingObjectWhs = Sets.immutableEnumSet(WhWord.WHY, WhWord.WHAT);

    @Option(name="-port",usage="Port the HTTP server listens on")
    public int port;

    @Option(name="-input",usage="File of passages, separated by blank lines")
    public String inputFile = null;

    @Option(name="-missing_object_wh",usage="WH-word for clauses without an object: WHY or WHAT")
    public WhWord missingObjectWh;

    @Option(name="-max_chars",usage="Longest passage accepted, in characters")
    public int maxChars;

    @Option(name="-annotators",usage="CoreNLP annotators to run")
    public String annotators;

    @Option(name="-help",usage="Print usage")
    public boolean help = false;

    @Argument(metaVar="TEXT",multiValued=true,usage="Passage to generate questions from")
    public List<String> text = new ArrayList<>();

    public QuestionGenerationConfig() {
        final Properties defaults = loadResource(DEFAULTS_RESOURCE);
        port = Integer.parseInt(defaults.getProperty("easyqg.port", "6000"));
        missingObjectWh = WhWord.valueOf(defaults.getProperty("easyqg.missing_object_wh", "WHY").toUpperCase());
        Preconditions.checkArgument(missingObjectWhs.contains(missingObjectWh),
                "easyqg.missing_object_wh must be WHY or WHAT, not %s", missingObjectWh);
        maxChars = Integer.parseInt(defaults.getProperty("easyqg.max_chars", "20000"));
        annotators = defaults.getProperty("easyqg.annotators", "tokenize,ssplit,pos,lemma,ner,depparse");
    }

    public QuestionGenerationConfig(final String[] args) throws CmdLineException {
        this();
        final CmdLineParser parser = new CmdLineParser(this);
        parser.parseArgument(args);
        if (!missingObjectWhs.contains(missingObjectWh)) {
            throw new CmdLineException(parser,
                    String.format("-missing_object_wh must be WHY or WHAT, not %s", missingObjectWh));
        }
    }

    /**
     * CoreNLP pipeline settings, with the configured annotators.
     */
    public Properties getCoreNlpProperties() {
        final Properties properties = loadResource(CORENLP_RESOURCE);
        properties.setProperty("annotators", annotators);
        return properties;
    }

    public String getText() {
        return String.join(" ", text);
    }

    public void printUsage(final PrintStream out) {
        new CmdLineParser(this).printUsage(out);
    }

    static Properties loadResource(final String resource) {
        final Properties properties = new Properties();
        try (InputStream in = QuestionGenerationConfig.class.getResourceAsStream(resource)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + resource, e);
        }
        return properties;
    }

    public String toString() {
        return new StringBuilder()
                .append("Port=\t").append(port)
                .append("\nInput file=\t").append(inputFile)
                .append("\nMissing object WH=\t").append(missingObjectWh)
                .append("\nMax chars=\t").append(maxChars)
                .append("\nAnnotators=\t").append(annotators)
                .toString();
    }
}
