package com.traneptora.lightlevel;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;

import org.junit.jupiter.api.Test;

class ConfirmationTest {

    private static boolean answer(String input, StringWriter out) throws IOException {
        return Confirmation.interactive(new BufferedReader(new StringReader(input)), new PrintWriter(out))
            .confirm("Continue?");
    }

    @Test
    void testOnlyNoAborts() throws IOException {
        StringWriter out = new StringWriter();
        assertFalse(answer("n\n", out));
        assertTrue(out.toString().contains("Continue?"));
        assertTrue(out.toString().contains("Aborting!!!"));
        assertFalse(answer("N\n", new StringWriter()));
        assertTrue(answer("y\n", new StringWriter()));
        assertTrue(answer("no\n", new StringWriter()));
        assertTrue(answer("\n", new StringWriter()));
    }

    @Test
    void testEndOfInputContinues() throws IOException {
        StringWriter out = new StringWriter();
        assertTrue(answer("", out));
        assertTrue(out.toString().contains("Continuing"));
    }

    @Test
    void testAlways() throws IOException {
        assertTrue(Confirmation.ALWAYS.confirm("anything"));
    }
}
