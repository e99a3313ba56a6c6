package com.traneptora.lightlevel;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;

/**
 * Asks the operator whether to go on after a warning.
 */
@FunctionalInterface
public interface Confirmation {

    public static final Confirmation ALWAYS = prompt -> true;

    /**
     * @return true to continue, false to abort
     */
    public boolean confirm(String prompt) throws IOException;

    /**
     * Prints the prompt and reads one line. Only {@code N} or {@code n}
     * aborts; anything else, including end of input, continues.
     */
    public static Confirmation interactive(BufferedReader in, PrintWriter out) {
        return prompt -> {
            out.println(prompt);
            out.flush();
            String answer = in.readLine();
            boolean proceed = !"N".equals(answer) && !"n".equals(answer);
            out.println(proceed ? "Continuing" : "Aborting!!!");
            out.flush();
            return proceed;
        };
    }
}
