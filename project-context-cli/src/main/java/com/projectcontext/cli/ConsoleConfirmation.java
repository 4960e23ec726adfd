package com.projectcontext.cli;

import com.projectcontext.core.model.ConfirmationResponse;
import com.projectcontext.core.safeguard.ConfirmationCallback;
import com.projectcontext.core.safeguard.ConfirmationRequest;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Yes/no prompt on the console. Anything but "y" or "yes" is a refusal, and so is
 * end of input.
 */
class ConsoleConfirmation implements ConfirmationCallback {

    private final BufferedReader in;
    private final PrintStream out;

    ConsoleConfirmation(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public ConfirmationResponse confirm(ConfirmationRequest request) throws IOException {
        request.validation().warnings().forEach(warning -> out.println("⚠ " + warning));
        out.print(request.prompt() + " [y/N] ");
        out.flush();
        String answer = in.readLine();
        if (answer == null) {
            return ConfirmationResponse.NO;
        }
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("y") || normalized.equals("yes") ? ConfirmationResponse.YES : ConfirmationResponse.NO;
    }
}
