package dev.nolij.jerry.cli;

import dev.nolij.jerry.Jerry;
import dev.nolij.jerry.JerryParser;
import dev.nolij.jerry.JerryValue;
import dev.nolij.jerry.JerryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(
	name = "jerry",
	description = "a JSON parser experiment",
	version = "jerry 1.0.0",
	mixinStandardHelpOptions = true)
public final class JerryCli implements Callable<Integer> {
	private static final Logger LOG = LoggerFactory.getLogger(JerryCli.class);

	@CommandLine.Spec
	private CommandLine.Model.CommandSpec spec;

	@CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "the file to parse")
	private Path file;

	@CommandLine.Option(
		names = "--indent",
		defaultValue = "2",
		description = "Spaces per indentation level in the output (default: ${DEFAULT-VALUE})")
	private int indent;

	@CommandLine.Option(
		names = "--compact-arrays",
		description = "Print array elements on one line")
	private boolean compactArrays;

	@CommandLine.Option(
		names = "--no-empty-objects",
		description = "Reject {} instead of reading it as an empty object")
	private boolean noEmptyObjects;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new JerryCli()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() throws Exception {
		if (indent < 0)
			throw new CommandLine.ParameterException(spec.commandLine(), "--indent must not be negative, got " + indent);

		if (!Files.isRegularFile(file)) {
			spec.commandLine().getErr().println("Error: File not found: " + file);
			return 1;
		}

		JerryParser parser = new JerryParser().withEmptyObjects(!noEmptyObjects);
		JerryValue tree = Jerry.parseFile(file, parser);
		LOG.debug("Parsed {} into a top-level {}", file, tree.type);

		JerryWriter writer = new JerryWriter()
			.withIndent(" ".repeat(indent))
			.withExpandArrays(!compactArrays);

		PrintWriter out = spec.commandLine().getOut();
		out.println(writer.stringify(tree));
		out.flush();
		return 0;
	}
}
