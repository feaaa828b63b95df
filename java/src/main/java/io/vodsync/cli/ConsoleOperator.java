package io.vodsync.cli;

import io.vodsync.auth.Operator;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Prompts on the terminal. The password is read without echo when a console is attached; the captcha is printed
 * as ASCII art.
 */
public final class ConsoleOperator implements Operator {

    private final BufferedReader in;
    private final PrintStream out;
    private final Console console;

    public ConsoleOperator() {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out,
            System.console());
    }

    ConsoleOperator(BufferedReader in, PrintStream out, Console console) {
        this.in = in;
        this.out = out;
        this.console = console;
    }

    @Override
    public String username(String previous) {
        String prompt = previous == null ? "Enter username: " : "Enter username(" + previous + "): ";
        String answer = readLine(prompt);
        if (answer != null && answer.isBlank() && previous != null) {
            out.println("Using username: " + previous);
        }
        return answer;
    }

    @Override
    public String password(String username) {
        if (console != null) {
            char[] secret = console.readPassword("Enter password: ");
            return secret == null ? null : new String(secret);
        }
        return readLine("Enter password: ");
    }

    @Override
    public String captcha(byte[] image) {
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image));
            if (decoded == null) {
                out.println("(captcha format not recognised, " + image.length + " bytes)");
            } else {
                out.print(asciiArt(decoded));
            }
        } catch (IOException ex) {
            out.println("(captcha image could not be decoded: " + ex.getMessage() + ")");
        }
        String answer = readLine("Enter captcha: ");
        return answer == null ? null : answer.trim();
    }

    /**
     * @return the line read, or {@code null} at end of input.
     */
    private String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            return in.readLine();
        } catch (IOException ex) {
            throw new UncheckedIOException("read from terminal", ex);
        }
    }

    /**
     * Renders the image as {@code #} for dark and space for light pixels, thresholded at the midpoint of the image's
     * own luminance range, with all-light border rows and columns cut off.
     */
    static String asciiArt(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[][] gray = new int[height][width];
        int min = 255;
        int max = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = image.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                int luma = (r * 299 + g * 587 + b * 114) / 1000;
                gray[y][x] = luma;
                min = Math.min(min, luma);
                max = Math.max(max, luma);
            }
        }
        boolean[][] dark = new boolean[height][width];
        double range = Math.max(1, max - min);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                dark[y][x] = (gray[y][x] - min) / range <= 0.5;
            }
        }

        int top = 0;
        int bottom = height - 1;
        int left = 0;
        int right = width - 1;
        while (top <= bottom && rowIsLight(dark[top], left, right)) {
            top++;
        }
        while (bottom >= top && rowIsLight(dark[bottom], left, right)) {
            bottom--;
        }
        while (left <= right && columnIsLight(dark, left, top, bottom)) {
            left++;
        }
        while (right >= left && columnIsLight(dark, right, top, bottom)) {
            right--;
        }

        StringBuilder art = new StringBuilder();
        for (int y = top; y <= bottom; y++) {
            for (int x = left; x <= right; x++) {
                art.append(dark[y][x] ? '#' : ' ');
            }
            art.append('\n');
        }
        return art.toString();
    }

    private static boolean rowIsLight(boolean[] row, int from, int to) {
        for (int x = from; x <= to; x++) {
            if (row[x]) {
                return false;
            }
        }
        return true;
    }

    private static boolean columnIsLight(boolean[][] dark, int x, int from, int to) {
        for (int y = from; y <= to; y++) {
            if (dark[y][x]) {
                return false;
            }
        }
        return true;
    }
}
