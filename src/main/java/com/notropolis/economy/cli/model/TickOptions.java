package com.notropolis.economy.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "tick" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class TickOptions {

	@Option(names = { "--world", "-w" }, required = true, description = "World snapshot JSON to load")
	private Path world;

	@Option(names = { "--ticks", "-t" }, defaultValue = "1", description = "Number of ticks to run (default: 1)")
	private int ticks;

	@Option(names = {
			"--recompute-budget-ms" }, defaultValue = "30000", description = "Time budget of one recompute pass in milliseconds")
	private long recomputeBudgetMs;

	@Option(names = {
			"--lease-timeout-ms" }, defaultValue = "5000", description = "How long a recompute waits for a busy map in milliseconds")
	private long leaseTimeoutMs;

	@Option(names = { "--output", "-o" }, description = "Write the resulting world snapshot to this file")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite the output file if it exists")
	private boolean force;
}
