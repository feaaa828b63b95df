package io.vodsync.cli;

import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleOperatorTest {

    @Test
    void asciiArtCropsLightBorder() {
        BufferedImage image = new BufferedImage(6, 4, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.WHITE);
        g.fillRect(0, 0, 6, 4);
        g.setColor(Color.BLACK);
        g.fillRect(2, 1, 2, 1);
        g.fillRect(2, 2, 1, 1);
        g.dispose();

        assertEquals("##\n# \n", ConsoleOperator.asciiArt(image));
    }

    @Test
    void promptsAndTrimsAnswers() throws Exception {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, 0xffffff);
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(image, "png", png);

        ByteArrayOutputStream printed = new ByteArrayOutputStream();
        ConsoleOperator operator = new ConsoleOperator(
            new BufferedReader(new StringReader("\npw\n  x7k2 \n")),
            new PrintStream(printed, true, StandardCharsets.UTF_8),
            null);

        assertEquals("", operator.username("alice"));
        assertEquals("pw", operator.password("alice"));
        assertEquals("x7k2", operator.captcha(png.toByteArray()));

        String output = printed.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Enter username(alice): "));
        assertTrue(output.contains("Using username: alice"));
        assertTrue(output.contains("#\n"));
    }

    @Test
    void endOfInputAnswersNull() {
        ByteArrayOutputStream printed = new ByteArrayOutputStream();
        ConsoleOperator operator = new ConsoleOperator(
            new BufferedReader(new StringReader("")),
            new PrintStream(printed, true, StandardCharsets.UTF_8),
            null);

        assertNull(operator.username(null));
        assertNull(operator.username("alice"));
        assertNull(operator.password("alice"));
        assertNull(operator.captcha(new byte[]{1, 2, 3}));
        assertFalse(printed.toString(StandardCharsets.UTF_8).contains("Using username"));
    }

    @Test
    void undecodableCaptchaStillPrompts() {
        ByteArrayOutputStream printed = new ByteArrayOutputStream();
        ConsoleOperator operator = new ConsoleOperator(
            new BufferedReader(new StringReader("abcd\n")),
            new PrintStream(printed, true, StandardCharsets.UTF_8),
            null);

        assertEquals("abcd", operator.captcha(new byte[]{1, 2, 3}));
        assertTrue(printed.toString(StandardCharsets.UTF_8).contains("captcha"));
    }
}
