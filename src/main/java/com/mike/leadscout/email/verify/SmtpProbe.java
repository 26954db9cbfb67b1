package com.mike.leadscout.email.verify;

import com.mike.leadscout.config.EmailProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Asks a mail exchanger whether it would accept a recipient, without sending anything:
 * 220 greeting, HELO, MAIL FROM, RCPT TO, QUIT.
 */
@Component
@Slf4j
public class SmtpProbe {

    static final int SMTP_PORT = 25;

    private final EmailProperties.Smtp config;

    public SmtpProbe(EmailProperties props) {
        this.config = props.smtp();
    }

    public boolean isEnabled() {
        return config != null && config.enabled();
    }

    public SmtpVerdict probe(String mxHost, String email) {
        if (!isEnabled()) return SmtpVerdict.UNKNOWN;

        int timeoutMs = (int) (config.timeout() == null ? Duration.ofSeconds(10) : config.timeout()).toMillis();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(mxHost, SMTP_PORT), timeoutMs);
            socket.setSoTimeout(timeoutMs);

            BufferedReader in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.US_ASCII));
            PrintWriter out = new PrintWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.US_ASCII), true);
            return converse(in, out, email, mxHost);
        } catch (IOException e) {
            log.debug("SmtpProbe: {} unreachable for {}: {}", mxHost, email, e.getMessage());
            return SmtpVerdict.UNKNOWN;
        }
    }

    SmtpVerdict converse(BufferedReader in, PrintWriter out, String email, String mxHost) throws IOException {
        int greeting = readReply(in);
        if (greeting != 220) {
            log.debug("SmtpProbe: {} greeted with {}", mxHost, greeting);
            return SmtpVerdict.UNKNOWN;
        }

        if (command(in, out, "HELO " + heloHost()) != 250) return quit(out, SmtpVerdict.UNKNOWN);
        if (command(in, out, "MAIL FROM:<" + mailFrom() + ">") != 250) return quit(out, SmtpVerdict.UNKNOWN);

        int rcpt = command(in, out, "RCPT TO:<" + email + ">");
        SmtpVerdict verdict;
        if (rcpt == 250 || rcpt == 251) {
            verdict = SmtpVerdict.ACCEPTED;
        } else if (rcpt >= 500 && rcpt < 600) {
            verdict = SmtpVerdict.REJECTED;
        } else {
            verdict = SmtpVerdict.UNKNOWN;
        }
        log.debug("SmtpProbe: {} RCPT {} -> {} ({})", mxHost, email, rcpt, verdict);
        return quit(out, verdict);
    }

    private int command(BufferedReader in, PrintWriter out, String line) throws IOException {
        out.print(line + "\r\n");
        out.flush();
        return readReply(in);
    }

    private SmtpVerdict quit(PrintWriter out, SmtpVerdict verdict) {
        out.print("QUIT\r\n");
        out.flush();
        return verdict;
    }

    /**
     * Reads a possibly multi-line reply ("250-..." continuation lines, "250 ..." last line).
     * Returns the reply code, or -1 when the connection closed.
     */
    static int readReply(BufferedReader in) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.length() < 3) continue;
            int code;
            try {
                code = Integer.parseInt(line.substring(0, 3));
            } catch (NumberFormatException e) {
                return -1;
            }
            if (line.length() == 3 || line.charAt(3) != '-') {
                return code;
            }
        }
        return -1;
    }

    private String heloHost() {
        return config.heloHost() == null || config.heloHost().isBlank() ? "localhost" : config.heloHost();
    }

    private String mailFrom() {
        return config.mailFrom() == null || config.mailFrom().isBlank() ? "verify@localhost" : config.mailFrom();
    }
}
