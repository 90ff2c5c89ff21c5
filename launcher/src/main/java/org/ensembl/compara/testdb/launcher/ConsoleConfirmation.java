package org.ensembl.compara.testdb.launcher;

import org.ensembl.compara.testdb.db.Confirmation;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Prompts on the terminal and decides on the first character typed:
 * {@code y} or {@code Y} proceeds, anything else, including end of input,
 * declines. Blocks until input arrives.
 */
public class ConsoleConfirmation implements Confirmation {

    private final Reader in;
    private final PrintStream out;

    public ConsoleConfirmation(InputStream in, PrintStream out) {
        this.in = new InputStreamReader(in, StandardCharsets.UTF_8);
        this.out = out;
    }

    @Override
    public boolean confirm(String question) {
        out.println();
        out.print(question);
        out.flush();
        try {
            int c = in.read();
            return c == 'y' || c == 'Y';
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read confirmation", e);
        }
    }
}
