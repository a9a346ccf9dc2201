package edu.uw.easyqg.ui;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.uw.easyqg.annotation.Annotator;
import edu.uw.easyqg.annotation.SharedAnnotator;
import edu.uw.easyqg.main.QuestionGenerationConfig;
import edu.uw.easyqg.qg.QuestionGenerator;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.kohsuke.args4j.CmdLineException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Question generation over HTTP.
 * POST /genquest {"blurb": "..."} answers 201 {"questions": [...]}.
 * Usage: GenQuestServer [-port N] [-missing_object_wh WHY|WHAT] [-max_chars N]
 */
public class GenQuestServer extends AbstractHandler {
    private static final Logger log = LoggerFactory.getLogger(GenQuestServer.class);

    static final String PATH = "/genquest";
    static final int SC_UNPROCESSABLE_ENTITY = 422;

    private static final ObjectMapper mapper = new ObjectMapper();

    private final Annotator annotator;
    private final QuestionGenerationConfig config;

    public GenQuestServer(final Annotator annotator, final QuestionGenerationConfig config) {
        this.annotator = annotator;
        this.config = config;
    }

    @Override
    public void handle(final String target, final Request baseRequest, final HttpServletRequest request,
                       final HttpServletResponse response) throws IOException, ServletException {
        if (!PATH.equals(target)) {
            return;
        }
        baseRequest.setHandled(true);
        if (!"POST".equals(request.getMethod())) {
            response.setHeader("Allow", "POST");
            sendError(response, HttpServletResponse.SC_METHOD_NOT_ALLOWED, "only POST is supported");
            return;
        }

        // Raw bytes: Jackson detects the encoding itself, whatever charset the Content-Type claims.
        final JsonNode body;
        try {
            body = mapper.readTree(request.getInputStream());
        } catch (final JsonProcessingException e) {
            log.info("Rejected request with malformed JSON: {}", e.getOriginalMessage());
            sendError(response, HttpServletResponse.SC_BAD_REQUEST, "request body is not valid JSON");
            return;
        }
        if (body == null || !body.isObject()) {
            log.info("Rejected request without a JSON object body");
            sendError(response, HttpServletResponse.SC_BAD_REQUEST, "request body must be a JSON object");
            return;
        }
        final JsonNode blurb = body.get("blurb");
        if (blurb == null || !blurb.isTextual()) {
            log.info("Rejected request without a blurb");
            sendError(response, SC_UNPROCESSABLE_ENTITY, "missing string field 'blurb'");
            return;
        }
        final String text = blurb.asText();
        if (text.length() > config.maxChars) {
            log.info("Rejected blurb of {} characters (limit {})", text.length(), config.maxChars);
            sendError(response, HttpServletResponse.SC_REQUEST_ENTITY_TOO_LARGE,
                    String.format("blurb is longer than %d characters", config.maxChars));
            return;
        }

        final ImmutableList<String> questions;
        try {
            questions = QuestionGenerator.fromText(annotator, text, config.missingObjectWh).getQuestionStrings();
        } catch (final IllegalStateException e) {
            log.error("Question generation failed", e);
            sendError(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "annotator unavailable");
            return;
        }
        log.info("Generated {} questions from a blurb of {} characters", questions.size(), text.length());
        response.setStatus(HttpServletResponse.SC_CREATED);
        response.setContentType("application/json; charset=utf-8");
        mapper.writeValue(response.getWriter(), ImmutableMap.of("questions", questions));
    }

    private static void sendError(final HttpServletResponse response, final int status, final String message)
            throws IOException {
        response.setStatus(status);
        response.setContentType("application/json; charset=utf-8");
        mapper.writeValue(response.getWriter(), ImmutableMap.of("error", message));
    }

    public static Server createServer(final int port, final Annotator annotator,
                                      final QuestionGenerationConfig config) {
        final Server server = new Server(port);
        server.setHandler(new GenQuestServer(annotator, config));
        return server;
    }

    public static void main(final String[] args) throws Exception {
        final QuestionGenerationConfig config;
        try {
            config = new QuestionGenerationConfig(args);
        } catch (final CmdLineException e) {
            System.err.println(e.getMessage());
            new QuestionGenerationConfig().printUsage(System.err);
            System.exit(1);
            return;
        }
        System.err.println(config.toString());
        final Server server = createServer(config.port, SharedAnnotator.coreNlp(config.getCoreNlpProperties()),
                config);
        server.start();
        log.info("Listening on port {}", config.port);
        server.join();
    }
}
