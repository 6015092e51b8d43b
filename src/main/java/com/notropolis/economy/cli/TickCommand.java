package com.notropolis.economy.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.EconomyEngine;
import com.notropolis.economy.cli.exception.OptionsValidationException;
import com.notropolis.economy.cli.model.TickOptions;
import com.notropolis.economy.cli.model.ValidatedTickOptions;
import com.notropolis.economy.cli.output.TickResultsPrinter;
import com.notropolis.economy.cli.validation.TickOptionsValidator;
import com.notropolis.economy.error.GameException;
import com.notropolis.economy.store.InMemoryGameStore;
import com.notropolis.economy.store.WorldSnapshot;
import com.notropolis.economy.store.WorldSnapshotIO;
import com.notropolis.economy.tick.TickSummary;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that loads a world snapshot, runs economy ticks over it and
 * optionally writes the resulting world back out.
 */
@Command(
        name = "tick",
        mixinStandardHelpOptions = true,
        version = "notropolis-economy 1.0.0",
        description = "Runs economy ticks (profit recompute and income) over a world snapshot."
)
public class TickCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TickCommand.class);

    @Mixin
    private TickOptions options = new TickOptions();

    private final TickOptionsValidator validator = new TickOptionsValidator();
    private final TickResultsPrinter printer = new TickResultsPrinter();
    private final WorldSnapshotIO snapshots = new WorldSnapshotIO();

    @Override
    public Integer call() {
        try {
            ValidatedTickOptions validated = validator.validate(options);

            WorldSnapshot world = snapshots.read(validated.getWorldFile());
            printer.printBanner(options, validated, world);

            InMemoryGameStore store = InMemoryGameStore.fromSnapshot(world);
            EconomyEngine engine = new EconomyEngine(store, validated.getEngineConfig());

            long totalNet = 0;
            for (int tick = 1; tick <= options.getTicks(); tick++) {
                TickSummary summary = engine.processTick();
                printer.printTick(tick, summary);
                totalNet += summary.getNetProfit();
            }

            if (validated.getOutputFile() != null) {
                snapshots.write(store.toSnapshot(), validated.getOutputFile());
            }
            printer.printSuccess(validated, options.getTicks(), totalNet);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 2;
        } catch (GameException e) {
            log.error("Run failed ({}): {}", e.getKind(), e.getMessage(), e);
            return 1;
        } catch (Exception e) {
            log.error("Run failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
