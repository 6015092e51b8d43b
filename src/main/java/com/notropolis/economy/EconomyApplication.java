package com.notropolis.economy;

import com.notropolis.economy.cli.TickCommand;

import picocli.CommandLine;

/**
 * Main entry point of the economy runner. Loads a world snapshot and advances it tick by tick.
 */
public class EconomyApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TickCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
