package com.chatrelay.common.input;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads lines from a console stream, optionally printing a prompt before each read.
 */
public class ConsoleOperatorInput implements OperatorInput {

    private final BufferedReader reader;
    private final PrintStream promptOut;
    private final String prompt;

    public ConsoleOperatorInput(InputStream in) {
        this(in, null, null);
    }

    public ConsoleOperatorInput(InputStream in, PrintStream promptOut, String prompt) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.promptOut = promptOut;
        this.prompt = prompt;
    }

    public static ConsoleOperatorInput stdin() {
        return new ConsoleOperatorInput(System.in);
    }

    @Override
    public String nextLine() throws IOException {
        if (promptOut != null && prompt != null) {
            promptOut.println(prompt);
            promptOut.flush();
        }
        return reader.readLine();
    }
}
