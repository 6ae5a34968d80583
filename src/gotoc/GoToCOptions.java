package gotoc;

import gotoc.formatters.IndentingBuffer;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class GoToCOptions {
	public static final String VERSION = "0.1.0";

	// fields read from the JSON configuration file
	public static final String OUTPUT_FIELD = "output";
	public static final String INDENT_FIELD = "indent";
	public static final String DEST_FILE_FIELD = "dest_file";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = { "-help" })
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = { "-quiet" })
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution ", aliases = { "-verbose" })
	public boolean logLvlVerbose = false;

	@Option(value = "-d Print the parsed tree to standard error before generating C", aliases = { "-dump" })
	public boolean dump = false;

	@Option(value = "-o Write the C code to this file instead of standard output")
	public String outputFilePath;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	public String inputFilePath;

	// spaces per nesting level in the generated code
	public int indent = IndentingBuffer.DEFAULT_INDENT;

	private final Options plumeOptions;
	private final String[] args;

	public GoToCOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("gotoc [options] ast.json", this);
	}

	public void printHelp(PrintStream out) {
		plumeOptions.printUsage(out);
	}

	public void parse() throws GoToCOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new GoToCOptionException(e.getMessage());
		}

		if (version || help) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new GoToCOptionException("expected exactly one input file, found " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (configFilePath == null || configFilePath.isEmpty()) {
			return;
		}

		String s;

		try {
			byte[] jsonBytes = Files.readAllBytes(Paths.get(configFilePath));
			s = new String(jsonBytes, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new GoToCOptionException("Error reading configuration file: " + ex.getMessage());
		}

		try {
			applyConfig(new JSONObject(s));
		} catch (JSONException e) {
			throw new GoToCOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
	}

	/**
	 * Fills the options the command line left unset from a configuration object of the form
	 * {"output": {"indent": 4, "dest_file": "out.c"}}
	 */
	void applyConfig(JSONObject config) throws GoToCOptionException {
		JSONObject output = config.optJSONObject(OUTPUT_FIELD);
		if (output == null) {
			return;
		}
		if (output.has(INDENT_FIELD)) {
			int configured = output.getInt(INDENT_FIELD);
			if (configured < 0) {
				throw new GoToCOptionException("indent must not be negative, was " + configured);
			}
			indent = configured;
		}
		if (outputFilePath == null && output.has(DEST_FILE_FIELD)) {
			outputFilePath = output.getString(DEST_FILE_FIELD);
		}
	}
}
