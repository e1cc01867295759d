package work.lcod.build.generate;

import java.io.Console;

/**
 * The process console. Considered non-interactive without an attached console or under a CI harness.
 */
public final class ConsoleTerminal implements Terminal {
    private final Console console = System.console();

    @Override
    public boolean isInteractive() {
        return console != null && !runningUnderHarness();
    }

    @Override
    public String readLine() {
        return console == null ? null : console.readLine();
    }

    @Override
    public void print(String text) {
        if (console != null) {
            console.printf("%s", text);
            console.flush();
        } else {
            System.out.print(text);
            System.out.flush();
        }
    }

    static boolean runningUnderHarness() {
        String ci = System.getenv("CI");
        return (ci != null && !ci.isBlank() && !"false".equalsIgnoreCase(ci))
            || System.getProperty("surefire.test.class.path") != null;
    }
}
