package org.tessera.cli.commands;

import com.typesafe.config.ConfigException;
import org.tessera.autotile.AutoTileRuleset;
import org.tessera.autotile.RulesetPatternParser;
import org.tessera.cli.CommandLineInterface;
import org.tessera.cli.config.TilemapSettings;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "rulesets",
    description = "List the configured rulesets in precedence order"
)
public class RulesetsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        final TilemapSettings settings;
        try {
            settings = TilemapSettings.from(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            spec.commandLine().getErr().println("Error loading rulesets: " + e.getMessage());
            return 1;
        }

        List<AutoTileRuleset> rulesets = settings.rulesets();
        out.println(rulesets.size() + " rulesets for tilesheet '" + settings.tilesheet().label() + "'");
        for (int i = 0; i < rulesets.size(); i++) {
            out.println();
            out.println("#" + i + " -> tile " + rulesets.get(i).getTileId());
            for (String row : RulesetPatternParser.format(rulesets.get(i))) {
                out.println("  " + row);
            }
        }
        out.flush();
        return 0;
    }
}
