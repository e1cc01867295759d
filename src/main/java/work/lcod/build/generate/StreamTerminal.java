package work.lcod.build.generate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * {@link Terminal} over explicit streams; interactivity is whatever the caller says it is.
 */
public final class StreamTerminal implements Terminal {
    private final BufferedReader input;
    private final PrintStream output;
    private final boolean interactive;

    public StreamTerminal(InputStream input, PrintStream output, boolean interactive) {
        this.input = new BufferedReader(new InputStreamReader(Objects.requireNonNull(input, "input"), StandardCharsets.UTF_8));
        this.output = Objects.requireNonNull(output, "output");
        this.interactive = interactive;
    }

    @Override
    public boolean isInteractive() {
        return interactive;
    }

    @Override
    public String readLine() {
        try {
            return input.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read terminal input", ex);
        }
    }

    @Override
    public void print(String text) {
        output.print(text);
        output.flush();
    }
}
