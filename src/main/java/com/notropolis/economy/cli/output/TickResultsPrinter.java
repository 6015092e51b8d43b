package com.notropolis.economy.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.notropolis.economy.cli.model.TickOptions;
import com.notropolis.economy.cli.model.ValidatedTickOptions;
import com.notropolis.economy.store.WorldSnapshot;
import com.notropolis.economy.tick.MapTickResult;
import com.notropolis.economy.tick.TickSummary;

/**
 * Responsible only for printing CLI output for the "tick" command.
 * No validation, no execution.
 */
public class TickResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(TickResultsPrinter.class);

    public void printBanner(TickOptions o, ValidatedTickOptions v, WorldSnapshot world) {
        log.info("=================================================");
        log.info("Notropolis Economy Runner");
        log.info("=================================================");
        log.info("World Snapshot: {}", v.getWorldFile());
        log.info("Maps: {}", world.getMaps().size());
        log.info("Tiles: {}", world.getTiles().size());
        log.info("Companies: {}", world.getCompanies().size());
        log.info("Buildings: {}", world.getBuildings().size());
        log.info("Ticks: {}", o.getTicks());
        log.info("Recompute Budget: {} ms", v.getEngineConfig().getRecomputeBudget().toMillis());
        log.info("Output: {}", v.getOutputFile() != null ? v.getOutputFile() : "None");
        log.info("=================================================");
    }

    public void printTick(int tickNumber, TickSummary summary) {
        log.info("");
        log.info("Tick {}: {} maps processed, {} failed, {} ms", tickNumber, summary.getMapsProcessed(),
                summary.getMapsFailed(), summary.getElapsed().toMillis());
        for (MapTickResult map : summary.getMapResults()) {
            log.info("  Map {}: recalculated={} paid={} idle={} gross={} tax={} net={} levelUps={}",
                    map.getMapId(), map.getBuildingsRecalculated(), map.getCompaniesUpdated(),
                    map.getIdleCompaniesAdvanced(), map.getGrossProfit(), map.getTaxAmount(), map.getNetProfit(),
                    map.getLevelUps());
        }
        if (summary.getFollowUpsCompleted() > 0) {
            log.info("  Follow-ups retried: {}", summary.getFollowUpsCompleted());
        }
    }

    public void printSuccess(ValidatedTickOptions v, int ticks, long totalNet) {
        log.info("");
        log.info("=================================================");
        log.info("RUN COMPLETE");
        log.info("=================================================");
        log.info("Ticks Run: {}", ticks);
        log.info("Total Net Income: {}", totalNet);
        if (v.getOutputFile() != null) {
            log.info("Snapshot Written: {}", v.getOutputFile());
        }
        log.info("=================================================");
    }
}
