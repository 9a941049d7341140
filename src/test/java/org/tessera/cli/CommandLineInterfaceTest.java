package org.tessera.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
public class CommandLineInterfaceTest {

    @Test
    public void testCliInitialization() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        assertEquals("tessera", cmd.getCommandName());
        assertTrue(cmd.getSubcommands().containsKey("bake"));
        assertTrue(cmd.getSubcommands().containsKey("rulesets"));
        assertTrue(cmd.getSubcommands().containsKey("help"));
    }

    @Test
    public void testVersionOption() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        assertEquals(0, cmd.execute("--version"));
        assertTrue(out.toString().contains("Tessera 1.0"));
    }
}
