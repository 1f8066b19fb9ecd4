package work.lcod.scoring.session.graal;

import java.util.LinkedHashMap;
import java.util.Map;
import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.graalvm.polyglot.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.scoring.session.EmbeddingService;
import work.lcod.scoring.session.SessionHandle;

/**
 * {@link EmbeddingService} backed by a GraalVM polyglot JavaScript context per session.
 *
 * <p>The published program registers its routines in the global {@code __lcodRoutines} object; each routine
 * declares its parameters ({@code kind}, and {@code length} for text) and exposes {@code run(args)}.
 */
public final class GraalJsEmbeddingService implements EmbeddingService {
    public static final int OK = 0;
    public static final int NO_ROUTINE = 1;
    public static final int UNDECLARED_PARAMETER = 2;
    public static final int TEXT_TOO_LONG = 3;
    public static final int ROUTINE_ERROR = 4;
    public static final int MISSING_OUTPUT = 5;
    public static final int SESSION_CLOSED = 6;

    static final String ROUTINES_GLOBAL = "__lcodRoutines";
    private static final Logger LOG = LoggerFactory.getLogger(GraalJsEmbeddingService.class);

    @Override
    public SessionHandle createSession() {
        Context context = Context
            .newBuilder("js")
            .allowExperimentalOptions(true)
            .option("engine.WarnInterpreterOnly", "false")
            .option("js.ecmascript-version", "2023")
            .build();
        return new JsSession(context);
    }

    @Override
    public void appendSourceLine(SessionHandle session, String line) {
        JsSession js = cast(session);
        js.source.append(line == null ? "" : line).append('\n');
    }

    @Override
    public int publish(SessionHandle session, String sourceText, String moduleId) {
        JsSession js = cast(session);
        if (!js.isOpen()) {
            return 0;
        }
        String text = sourceText == null || sourceText.isBlank() ? js.source.toString() : sourceText;
        try {
            js.context.eval(Source.newBuilder("js", text, moduleId + ".js").buildLiteral());
            Value routines = js.context.getBindings("js").getMember(ROUTINES_GLOBAL);
            if (routines == null || routines.isNull() || routines.getMemberKeys().isEmpty()) {
                LOG.debug("Module {} registered no scoring routine", moduleId);
                return 0;
            }
        } catch (PolyglotException ex) {
            LOG.debug("Module {} failed to publish: {}", moduleId, ex.getMessage());
            return 0;
        }
        return ++js.revision;
    }

    @Override
    public int selectRoutine(SessionHandle session, String routineName) {
        JsSession js = cast(session);
        if (!js.isOpen()) {
            return SESSION_CLOSED;
        }
        js.reset();
        try {
            Value routines = js.context.getBindings("js").getMember(ROUTINES_GLOBAL);
            if (routines == null || routines.isNull() || !routines.hasMember(routineName)) {
                return NO_ROUTINE;
            }
            Value routine = routines.getMember(routineName);
            Value run = routine.getMember("run");
            if (run == null || !run.canExecute()) {
                return NO_ROUTINE;
            }
            Value parameters = routine.getMember("parameters");
            Map<String, Declaration> declared = new LinkedHashMap<>();
            if (parameters != null && parameters.hasMembers()) {
                for (String name : parameters.getMemberKeys()) {
                    Declaration declaration = declaration(parameters.getMember(name));
                    if (declaration == null) {
                        LOG.debug("Routine {} declares parameter {} with an unreadable signature", routineName, name);
                        return NO_ROUTINE;
                    }
                    declared.put(name, declaration);
                }
            }
            js.selected = run;
            js.declared = declared;
            return OK;
        } catch (PolyglotException ex) {
            LOG.debug("Unable to select routine {}: {}", routineName, ex.getMessage());
            return NO_ROUTINE;
        }
    }

    @Override
    public int bindNumeric(SessionHandle session, String name, double value) {
        JsSession js = cast(session);
        int status = checkBindable(js, name, false);
        if (status == OK) {
            js.parameters.put(name, value);
        }
        return status;
    }

    @Override
    public int bindText(SessionHandle session, String name, String value) {
        JsSession js = cast(session);
        int status = checkBindable(js, name, true);
        if (status != OK) {
            return status;
        }
        String text = value == null ? "" : value;
        if (text.length() > js.declared.get(name).length()) {
            return TEXT_TOO_LONG;
        }
        js.parameters.put(name, text);
        return OK;
    }

    @Override
    public int execute(SessionHandle session) {
        JsSession js = cast(session);
        if (!js.isOpen()) {
            return SESSION_CLOSED;
        }
        if (js.selected == null) {
            return NO_ROUTINE;
        }
        js.outputs.clear();
        try {
            Value args = js.context.eval("js", "({})");
            js.parameters.forEach(args::putMember);
            Value result = js.selected.execute(args);
            if (result == null || !result.hasMembers()) {
                return MISSING_OUTPUT;
            }
            for (String key : result.getMemberKeys()) {
                Value member = result.getMember(key);
                if (member.isString()) {
                    js.outputs.put(key, member.asString());
                } else if (member.isNumber()) {
                    js.outputs.put(key, member.asDouble());
                }
            }
        } catch (PolyglotException ex) {
            LOG.debug("Scoring routine raised: {}", ex.getMessage());
            return ROUTINE_ERROR;
        }
        return js.outputs.size() >= 2 ? OK : MISSING_OUTPUT;
    }

    @Override
    public String readText(SessionHandle session, String name) {
        Object value = cast(session).outputs.get(name);
        if (!(value instanceof String text)) {
            throw new IllegalStateException("No text output named " + name);
        }
        return text;
    }

    @Override
    public double readNumeric(SessionHandle session, String name) {
        Object value = cast(session).outputs.get(name);
        if (!(value instanceof Double number)) {
            throw new IllegalStateException("No numeric output named " + name);
        }
        return number;
    }

    private static int checkBindable(JsSession js, String name, boolean text) {
        if (!js.isOpen()) {
            return SESSION_CLOSED;
        }
        if (js.selected == null) {
            return NO_ROUTINE;
        }
        Declaration declaration = js.declared.get(name);
        if (declaration == null || declaration.text() != text) {
            return UNDECLARED_PARAMETER;
        }
        return OK;
    }

    private static JsSession cast(SessionHandle session) {
        if (!(session instanceof JsSession js)) {
            throw new IllegalArgumentException("Session was not created by " + GraalJsEmbeddingService.class.getSimpleName());
        }
        return js;
    }

    private static Declaration declaration(Value spec) {
        if (spec == null || !spec.hasMembers()) {
            return null;
        }
        String kind = "numeric";
        if (spec.hasMember("kind")) {
            Value value = spec.getMember("kind");
            if (!value.isString()) {
                return null;
            }
            kind = value.asString();
        }
        int length = Integer.MAX_VALUE;
        if (spec.hasMember("length")) {
            Value value = spec.getMember("length");
            if (!value.fitsInInt()) {
                return null;
            }
            length = value.asInt();
        }
        return new Declaration("text".equals(kind), length);
    }

    private record Declaration(boolean text, int length) {}

    private static final class JsSession implements SessionHandle {
        private final Context context;
        private final StringBuilder source = new StringBuilder();
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Map<String, Object> outputs = new LinkedHashMap<>();
        private Map<String, Declaration> declared = Map.of();
        private Value selected;
        private int revision;
        private volatile boolean open = true;

        private JsSession(Context context) {
            this.context = context;
        }

        private void reset() {
            selected = null;
            declared = Map.of();
            parameters.clear();
            outputs.clear();
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void close() {
            if (!open) {
                return;
            }
            open = false;
            reset();
            context.close();
        }
    }
}
