package org.casbench.lexer;

import com.typesafe.config.Config;
import org.casbench.config.ConfigLoader;

/**
 * Settings that influence how a {@link Lexer} reports on its work. None of them change
 * which tokens are produced.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * casbench {
 *   lexer {
 *     trace-tokens = false  # log every produced token at DEBUG level
 *   }
 * }
 * </pre>
 *
 * @param traceTokens Whether each produced token is logged.
 */
public record LexerOptions(boolean traceTokens) {

    /** The configuration path of the lexer block. */
    public static final String CONFIG_PATH = "casbench.lexer";
    private static final String TRACE_TOKENS_KEY = "trace-tokens";

    private static volatile LexerOptions defaults;

    /**
     * Reads the options from the {@code casbench.lexer} block of the given configuration.
     * Keys that are absent keep their built-in defaults.
     *
     * @param config The resolved application configuration.
     * @return The options described by the configuration.
     * @throws com.typesafe.config.ConfigException.WrongType if a key has the wrong type.
     */
    public static LexerOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return new LexerOptions(false);
        }
        Config lexerConfig = config.getConfig(CONFIG_PATH);
        boolean traceTokens = lexerConfig.hasPath(TRACE_TOKENS_KEY) && lexerConfig.getBoolean(TRACE_TOKENS_KEY);
        return new LexerOptions(traceTokens);
    }

    /**
     * Returns the options from the application configuration, loaded on first use.
     * @return The default options.
     */
    public static LexerOptions defaults() {
        LexerOptions result = defaults;
        if (result == null) {
            synchronized (LexerOptions.class) {
                result = defaults;
                if (result == null) {
                    result = fromConfig(ConfigLoader.load());
                    defaults = result;
                }
            }
        }
        return result;
    }
}
