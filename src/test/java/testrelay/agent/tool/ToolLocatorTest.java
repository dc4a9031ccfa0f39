package testrelay.agent.tool;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolLocatorTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("Candidates follow explicit, home, well-known, PATH order")
    void candidateOrder() {
        Path wellKnown = tmp.resolve("opt/jmeter/bin/jmeter");
        String searchPath = tmp.resolve("a") + File.pathSeparator + File.pathSeparator + tmp.resolve("b");

        ToolLocator locator = new ToolLocator("/custom/jmeter", tmp.resolve("home").toString(),
                List.of(wellKnown), searchPath, false);

        assertEquals(List.of(
                Path.of("/custom/jmeter"),
                tmp.resolve("home").resolve("bin").resolve("jmeter"),
                wellKnown,
                tmp.resolve("a").resolve("jmeter"),
                tmp.resolve("b").resolve("jmeter")), locator.candidates());
    }

    @Test
    @DisplayName("Windows looks for jmeter.bat under JMETER_HOME")
    void windowsLauncherName() {
        ToolLocator locator = new ToolLocator(null, tmp.toString(), List.of(), null, true);

        assertEquals(List.of(tmp.resolve("bin").resolve("jmeter.bat")), locator.candidates());
        assertTrue(ToolLocator.defaultLocations(true).stream()
                .allMatch(p -> p.toString().endsWith("jmeter.bat")));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("First executable candidate wins")
    void firstExecutableWins() throws Exception {
        Path home = tmp.resolve("home");
        Path homeLauncher = executable(home.resolve("bin").resolve("jmeter"));
        Path pathDir = tmp.resolve("path");
        executable(pathDir.resolve("jmeter"));

        ToolLocator locator = new ToolLocator(tmp.resolve("missing").toString(), home.toString(),
                List.of(), pathDir.toString(), false);

        assertEquals(homeLauncher, locator.locate());
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    @DisplayName("Non-executable files are skipped")
    void skipsNonExecutable() throws Exception {
        Path plain = tmp.resolve("plain").resolve("jmeter");
        Files.createDirectories(plain.getParent());
        Files.writeString(plain, "#!/bin/sh\n");
        assertTrue(plain.toFile().setExecutable(false));

        Path onPath = executable(tmp.resolve("path").resolve("jmeter"));

        ToolLocator locator = new ToolLocator(plain.toString(), null, List.of(),
                onPath.getParent().toString(), false);

        assertEquals(onPath, locator.locate());
    }

    @Test
    @DisplayName("Directories named jmeter are not launchers")
    void skipsDirectories() throws Exception {
        Path dir = Files.createDirectories(tmp.resolve("jmeter"));

        ToolLocator locator = new ToolLocator(dir.toString(), null, List.of(), null, false);

        assertThrows(ToolNotFoundException.class, locator::locate);
    }

    @Test
    @DisplayName("Nothing found reports how to fix it")
    void notFound() {
        ToolLocator locator = new ToolLocator(null, null, List.of(tmp.resolve("nope")), "", false);

        ToolNotFoundException e = assertThrows(ToolNotFoundException.class, locator::locate);
        assertEquals(ToolLocator.NOT_FOUND_MESSAGE, e.getMessage());
    }

    private static Path executable(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "#!/bin/sh\nexit 0\n");
        assertTrue(file.toFile().setExecutable(true));
        return file;
    }
}
