package com.parallax.agent;

import com.parallax.core.agent.AgentTool;
import com.parallax.core.model.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.ai.tool.function.FunctionToolCallback;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File, shell and web tools for one agent session, confined to a workspace
 * root. Every call is recorded as a {@link ToolInvocation} with its path
 * relative to the root.
 * <p>
 * A failing tool call does not end the session: the error text is returned
 * to the model and the invocation is recorded as unsuccessful.
 */
public class WorkspaceTools {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceTools.class);

    static final int MAX_LISTED_MATCHES = 500;
    private static final Duration FETCH_TIMEOUT = Duration.ofSeconds(30);

    private final Path root;
    private final int maxOutputChars;
    private final Duration bashTimeout;
    private final HttpClient httpClient;
    private final List<ToolInvocation> invocations = Collections.synchronizedList(new ArrayList<>());

    public WorkspaceTools(Path root, int maxOutputChars, Duration bashTimeout) {
        this.root = root.toAbsolutePath().normalize();
        this.maxOutputChars = maxOutputChars;
        this.bashTimeout = bashTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public record ReadFileInput(@ToolParam(description = "File path relative to the workspace root") String path) {}

    public record WriteFileInput(
            @ToolParam(description = "File path relative to the workspace root") String path,
            @ToolParam(description = "Full new content of the file") String content) {}

    public record EditFileInput(
            @ToolParam(description = "File path relative to the workspace root") String path,
            @ToolParam(description = "Exact text to replace; must occur exactly once") String oldText,
            @ToolParam(description = "Replacement text") String newText) {}

    public record BashInput(@ToolParam(description = "Shell command run from the workspace root") String command) {}

    public record GlobInput(@ToolParam(description = "Glob pattern such as src/**/*.java") String pattern) {}

    public record GrepInput(
            @ToolParam(description = "Java regular expression") String pattern,
            @ToolParam(description = "Directory or file to search, relative to the workspace root", required = false)
            String path) {}

    public record WebFetchInput(@ToolParam(description = "Absolute http or https URL") String url) {}

    /**
     * Builds callbacks for the granted tools only.
     */
    public List<ToolCallback> callbacks(Set<AgentTool> granted) {
        var callbacks = new ArrayList<ToolCallback>();
        for (AgentTool tool : granted) {
            callbacks.add(callbackFor(tool));
        }
        return callbacks;
    }

    /** Snapshot of the calls made so far, in call order. */
    public List<ToolInvocation> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    private ToolCallback callbackFor(AgentTool tool) {
        return switch (tool) {
            case READ -> FunctionToolCallback
                    .builder(tool.toolName(), (ReadFileInput in) -> readFile(in.path()))
                    .description("Read a UTF-8 text file from the workspace")
                    .inputType(ReadFileInput.class)
                    .build();
            case WRITE -> FunctionToolCallback
                    .builder(tool.toolName(), (WriteFileInput in) -> writeFile(in.path(), in.content()))
                    .description("Create or overwrite a file in the workspace")
                    .inputType(WriteFileInput.class)
                    .build();
            case EDIT -> FunctionToolCallback
                    .builder(tool.toolName(), (EditFileInput in) -> editFile(in.path(), in.oldText(), in.newText()))
                    .description("Replace one exact occurrence of a text fragment in a workspace file")
                    .inputType(EditFileInput.class)
                    .build();
            case BASH -> FunctionToolCallback
                    .builder(tool.toolName(), (BashInput in) -> bash(in.command()))
                    .description("Run a shell command in the workspace and return its combined output")
                    .inputType(BashInput.class)
                    .build();
            case GLOB -> FunctionToolCallback
                    .builder(tool.toolName(), (GlobInput in) -> glob(in.pattern()))
                    .description("List workspace files matching a glob pattern")
                    .inputType(GlobInput.class)
                    .build();
            case GREP -> FunctionToolCallback
                    .builder(tool.toolName(), (GrepInput in) -> grep(in.pattern(), in.path()))
                    .description("Search workspace files for lines matching a regular expression")
                    .inputType(GrepInput.class)
                    .build();
            case WEB_FETCH -> FunctionToolCallback
                    .builder(tool.toolName(), (WebFetchInput in) -> webFetch(in.url()))
                    .description("Fetch the body of a web page")
                    .inputType(WebFetchInput.class)
                    .build();
        };
    }

    // --- tools ---

    public String readFile(String path) {
        return record(AgentTool.READ, Map.of("path", nullToEmpty(path)), path, () -> {
            Path file = resolve(path);
            return truncate(Files.readString(file, StandardCharsets.UTF_8));
        });
    }

    public String writeFile(String path, String content) {
        String body = nullToEmpty(content);
        return record(AgentTool.WRITE, Map.of("path", nullToEmpty(path), "content", body), path, () -> {
            Path file = resolve(path);
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, body, StandardCharsets.UTF_8);
            return "Wrote " + body.length() + " chars to " + relative(file);
        });
    }

    public String editFile(String path, String oldText, String newText) {
        var input = new LinkedHashMap<String, Object>();
        input.put("path", nullToEmpty(path));
        input.put("old_text", nullToEmpty(oldText));
        input.put("new_text", nullToEmpty(newText));
        return record(AgentTool.EDIT, input, path, () -> {
            if (oldText == null || oldText.isEmpty()) {
                throw new IllegalArgumentException("old_text must not be empty");
            }
            Path file = resolve(path);
            String content = Files.readString(file, StandardCharsets.UTF_8);
            int occurrences = countOccurrences(content, oldText);
            if (occurrences != 1) {
                throw new IllegalArgumentException("old_text occurs " + occurrences + " times in "
                        + relative(file) + ", expected exactly once");
            }
            Files.writeString(file, content.replace(oldText, nullToEmpty(newText)), StandardCharsets.UTF_8);
            return "Edited " + relative(file);
        });
    }

    public String bash(String command) {
        return record(AgentTool.BASH, Map.of("command", nullToEmpty(command)), null, () -> {
            Path output = Files.createTempFile("parallax-bash-", ".log");
            try {
                Process process = new ProcessBuilder("sh", "-c", nullToEmpty(command))
                        .directory(root.toFile())
                        .redirectErrorStream(true)
                        .redirectOutput(output.toFile())
                        .start();
                if (!process.waitFor(bashTimeout.toSeconds(), TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                    throw new IOException("Command timed out after " + bashTimeout.toSeconds() + "s");
                }
                String text = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
                int exitCode = process.exitValue();
                if (exitCode != 0) {
                    throw new IOException("Exit code " + exitCode + "\n" + truncate(text));
                }
                return truncate(text);
            } finally {
                Files.deleteIfExists(output);
            }
        });
    }

    public String glob(String pattern) {
        return record(AgentTool.GLOB, Map.of("pattern", nullToEmpty(pattern)), null, () -> {
            var matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            try (Stream<Path> files = Files.walk(root)) {
                List<String> matches = files.filter(Files::isRegularFile)
                        .map(this::relative)
                        .filter(rel -> matcher.matches(Path.of(rel)))
                        .sorted()
                        .limit(MAX_LISTED_MATCHES)
                        .collect(Collectors.toList());
                return matches.isEmpty() ? "No files match " + pattern : String.join("\n", matches);
            }
        });
    }

    public String grep(String pattern, String path) {
        String scope = path == null || path.isBlank() ? "." : path;
        return record(AgentTool.GREP, Map.of("pattern", nullToEmpty(pattern), "path", scope), null, () -> {
            Pattern regex = Pattern.compile(pattern);
            Path start = resolve(scope);
            var hits = new ArrayList<String>();
            try (Stream<Path> files = Files.walk(start)) {
                for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile).sorted()::iterator) {
                    String[] lines = new String(Files.readAllBytes(file), StandardCharsets.UTF_8).split("\n", -1);
                    for (int i = 0; i < lines.length && hits.size() < MAX_LISTED_MATCHES; i++) {
                        if (regex.matcher(lines[i]).find()) {
                            hits.add(relative(file) + ":" + (i + 1) + ": " + lines[i]);
                        }
                    }
                    if (hits.size() >= MAX_LISTED_MATCHES) {
                        break;
                    }
                }
            }
            return hits.isEmpty() ? "No matches for " + pattern : truncate(String.join("\n", hits));
        });
    }

    public String webFetch(String url) {
        return record(AgentTool.WEB_FETCH, Map.of("url", nullToEmpty(url)), null, () -> {
            URI uri = URI.create(url);
            if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
                throw new IllegalArgumentException("Only http and https URLs can be fetched");
            }
            var request = HttpRequest.newBuilder(uri).timeout(FETCH_TIMEOUT).GET().build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new IOException("HTTP " + response.statusCode() + " from " + url);
            }
            return truncate(response.body());
        });
    }

    // --- plumbing ---

    @FunctionalInterface
    private interface ToolAction {
        String run() throws IOException, InterruptedException;
    }

    private String record(AgentTool tool, Map<String, Object> input, String rawPath, ToolAction action) {
        String resourcePath = rawPath != null ? relativeOrRaw(rawPath) : null;
        try {
            String result = action.run();
            invocations.add(new ToolInvocation(tool.toolName(), input, resourcePath, true));
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            invocations.add(new ToolInvocation(tool.toolName(), input, resourcePath, false));
            return "Error: interrupted";
        } catch (IOException | RuntimeException e) {
            log.warn("Tool {} failed: {}", tool.toolName(), e.getMessage());
            invocations.add(new ToolInvocation(tool.toolName(), input, resourcePath, false));
            return "Error: " + e.getMessage();
        }
    }

    /**
     * Resolves a workspace-relative path, rejecting anything that escapes the root.
     */
    Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the workspace: " + path);
        }
        return resolved;
    }

    private String relativeOrRaw(String path) {
        try {
            Path resolved = root.resolve(path).normalize();
            return resolved.startsWith(root) ? relative(resolved) : path;
        } catch (InvalidPathException e) {
            return path;
        }
    }

    private String relative(Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private String truncate(String text) {
        if (text.length() <= maxOutputChars) {
            return text;
        }
        return text.substring(0, maxOutputChars) + "\n... (" + (text.length() - maxOutputChars) + " chars truncated)";
    }

    private static int countOccurrences(String content, String fragment) {
        int count = 0;
        int from = 0;
        while ((from = content.indexOf(fragment, from)) >= 0) {
            count++;
            from += fragment.length();
        }
        return count;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
