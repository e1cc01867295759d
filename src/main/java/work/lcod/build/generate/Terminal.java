package work.lcod.build.generate;

/**
 * Line-oriented interaction with whoever runs the build.
 */
public interface Terminal {
    /** Whether a human can answer prompts. */
    boolean isInteractive();

    /** Next input line, or {@code null} once input is exhausted. */
    String readLine();

    void print(String text);

    default void println(String text) {
        print(text + System.lineSeparator());
    }

    default void println() {
        print(System.lineSeparator());
    }
}
