package dumb.natded;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.natded.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Front end settings, read from a JSON file and overridden by command line flags.
 *
 * @param json     print trees as JSON instead of canonical text
 * @param showFree also print the free variables of each parsed formula
 * @param prompt   interactive prompt
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Config(boolean json, boolean showFree, String prompt) {

    public static final String DEFAULT_PROMPT = "> ";
    public static final Config DEFAULT = new Config(false, false, DEFAULT_PROMPT);

    public Config {
        requireNonNull(prompt);
    }

    @JsonCreator
    public Config(
            @JsonProperty("json") @Nullable Boolean json,
            @JsonProperty("showFree") @Nullable Boolean showFree,
            @JsonProperty("prompt") @Nullable String prompt
    ) {
        this(
                json != null && json,
                showFree != null && showFree,
                prompt != null ? prompt : DEFAULT_PROMPT
        );
    }

    public static Config load(Path file) throws IOException {
        return Json.obj(file, Config.class);
    }

    public Config withJson(boolean json) {
        return new Config(json, showFree, prompt);
    }

    public Config withShowFree(boolean showFree) {
        return new Config(json, showFree, prompt);
    }
}
