package testrelay.agent.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.agent.AgentConfig;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Finds the JMeter launcher.
 *
 * Lookup order: explicit path, {@code JMETER_HOME/bin}, well-known install
 * locations, then the entries of {@code PATH}. The first executable file wins.
 */
public class ToolLocator {

    private static final Logger log = LoggerFactory.getLogger(ToolLocator.class);

    public static final String NOT_FOUND_MESSAGE =
            "JMeter not found. Set JMETER_HOME or install JMeter to a standard location";

    private final String explicitPath;
    private final String jmeterHome;
    private final List<Path> wellKnownLocations;
    private final String searchPath;
    private final boolean windows;

    public ToolLocator(String explicitPath, String jmeterHome, List<Path> wellKnownLocations, String searchPath,
            boolean windows) {
        this.explicitPath = explicitPath;
        this.jmeterHome = jmeterHome;
        this.wellKnownLocations = List.copyOf(wellKnownLocations);
        this.searchPath = searchPath;
        this.windows = windows;
    }

    /**
     * Locator for this host, configured from the agent settings.
     */
    public static ToolLocator forHost(AgentConfig config) {
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        return new ToolLocator(config.jmeterPath(), config.jmeterHome(), defaultLocations(windows),
                System.getenv("PATH"), windows);
    }

    static List<Path> defaultLocations(boolean windows) {
        if (windows) {
            return List.of(
                    Path.of("C:\\apache-jmeter\\bin\\jmeter.bat"),
                    Path.of("C:\\Program Files\\Apache JMeter\\bin\\jmeter.bat"),
                    Path.of("C:\\jmeter\\bin\\jmeter.bat"));
        }
        return List.of(
                Path.of("/opt/apache-jmeter/bin/jmeter"),
                Path.of("/usr/local/apache-jmeter/bin/jmeter"),
                Path.of("/usr/share/jmeter/bin/jmeter"),
                Path.of("/opt/jmeter/bin/jmeter"),
                Path.of(System.getProperty("user.home"), "apache-jmeter", "bin", "jmeter"));
    }

    /**
     * @return the launcher to run
     * @throws ToolNotFoundException when no candidate exists
     */
    public Path locate() throws ToolNotFoundException {
        for (Path candidate : candidates()) {
            if (isUsable(candidate)) {
                log.debug("Using JMeter at {}", candidate);
                return candidate;
            }
        }
        throw new ToolNotFoundException(NOT_FOUND_MESSAGE);
    }

    List<Path> candidates() {
        List<Path> candidates = new ArrayList<>();

        if (explicitPath != null && !explicitPath.isBlank()) {
            candidates.add(Path.of(explicitPath));
        }

        if (jmeterHome != null && !jmeterHome.isBlank()) {
            candidates.add(Path.of(jmeterHome, "bin", launcherName()));
        }

        candidates.addAll(wellKnownLocations);

        if (searchPath != null && !searchPath.isBlank()) {
            for (String dir : searchPath.split(File.pathSeparator)) {
                if (!dir.isBlank()) {
                    candidates.add(Path.of(dir, launcherName()));
                }
            }
        }
        return candidates;
    }

    private String launcherName() {
        return windows ? "jmeter.bat" : "jmeter";
    }

    private boolean isUsable(Path candidate) {
        if (!Files.isRegularFile(candidate)) {
            return false;
        }
        return windows || Files.isExecutable(candidate);
    }
}
