package org.tessera.cli.commands;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.autotile.AutoTilemap;
import org.tessera.autotile.OccupancyMapReader;
import org.tessera.cli.CommandLineInterface;
import org.tessera.cli.config.TilemapSettings;
import org.tessera.tilemap.TileId;
import org.tessera.tilemap.TilemapSnapshot;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
    name = "bake",
    description = "Bake an occupancy map with the configured rulesets and print the resulting tile ids"
)
public class BakeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(BakeCommand.class);

    @Option(
        names = {"-m", "--map"},
        required = true,
        description = "Occupancy map file: one line per row, '#' = occupied, '.' = empty"
    )
    private Path mapFile;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: text, json (default: text)"
    )
    private String format = "text";

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            TilemapSettings settings = TilemapSettings.from(parent.getConfig());
            AutoTilemap autotilemap = OccupancyMapReader.read(
                mapFile, settings.tilesheet(), settings.tileSize(), settings.rulesets());
            autotilemap.bake();
            log.info("Baked '{}' ({}x{}) with {} rulesets", mapFile, autotilemap.getWidth(),
                autotilemap.getHeight(), autotilemap.getRulesets().size());

            switch (format.toLowerCase()) {
                case "json" -> printJson(autotilemap, out);
                case "text" -> printText(autotilemap, out);
                default -> {
                    err.println("Unknown output format: " + format);
                    return 1;
                }
            }
            out.flush();
            return 0;
        } catch (IOException | ConfigException | IllegalArgumentException e) {
            log.error("Failed to bake '{}': {}", mapFile, e.getMessage());
            err.println("Error baking map: " + e.getMessage());
            return 1;
        }
    }

    private void printText(AutoTilemap autotilemap, PrintWriter out) {
        int cellWidth = autotilemap.getRulesets().stream()
            .mapToInt(r -> r.getTileId().toString().length())
            .max()
            .orElse(1);
        for (int y = 0; y < autotilemap.getHeight(); y++) {
            StringBuilder line = new StringBuilder();
            for (int x = 0; x < autotilemap.getWidth(); x++) {
                if (x > 0) {
                    line.append(' ');
                }
                Optional<TileId> tile = autotilemap.getTileId(x, y);
                String cell = tile.map(TileId::toString).orElse(".");
                line.append(" ".repeat(cellWidth - cell.length())).append(cell);
            }
            out.println(line);
        }
    }

    private void printJson(AutoTilemap autotilemap, PrintWriter out) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        out.println(mapper.writeValueAsString(TilemapSnapshot.of(autotilemap.getTilemap())));
    }
}
