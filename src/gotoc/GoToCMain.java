package gotoc;

import gotoc.formatters.IndentingBuffer;
import gotoc.model.golang.GoModule;
import gotoc.parser.GoJsonAstReader;
import gotoc.trans.passes.codegen.CCodeGenPass;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

public class GoToCMain {
	private final String[] cmdArgs;
	private final PrintStream stdout;
	private final PrintStream stderr;
	private static Logger logger;

	public GoToCMain(String[] args, PrintStream stdout, PrintStream stderr) {
		cmdArgs = args;
		this.stdout = stdout;
		this.stderr = stderr;
		// Get the top Logger instance
		logger = Logger.getLogger("GoToCMain");
	}

	public static void main(String[] args) {
		if (new GoToCMain(args, System.out, System.err).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	private GoToCOptions parseOptions() throws GoToCOptionException {
		GoToCOptions opts = new GoToCOptions(cmdArgs);
		try {
			opts.parse();
		} catch (GoToCOptionException e) {
			opts.printHelp(stderr);
			throw e;
		}
		// set the logger's log level based on command line arguments
		if (opts.logLvlQuiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.logLvlVerbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			GoToCOptions opts = parseOptions();
			if (opts.version) {
				stdout.println("gotoc version " + GoToCOptions.VERSION);
				return true;
			}
			if (opts.help) {
				opts.printHelp(stdout);
				return true;
			}

			logger.info("Reading Go AST from \"" + opts.inputFilePath + "\"");
			File inputFile = new File(opts.inputFilePath);
			if (!inputFile.isFile()) {
				throw new GoToCOptionException("input file \"" + opts.inputFilePath + "\" does not exist");
			}
			GoModule module = GoJsonAstReader.readFile(inputFile);
			logger.fine("Read " + module.getDeclarations().size() + " top-level declaration(s)");

			if (opts.dump) {
				stderr.print(module);
				stderr.flush();
			}

			logger.info("Generating C code");
			IndentingBuffer code = CCodeGenPass.perform(module, opts.indent);

			if (opts.outputFilePath == null) {
				Writer writer = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
				code.writeTo(writer);
			} else {
				logger.info("Writing C code to \"" + opts.outputFilePath + "\"");
				try (Writer writer = Files.newBufferedWriter(Paths.get(opts.outputFilePath), StandardCharsets.UTF_8)) {
					code.writeTo(writer);
				}
			}
		} catch (GoToCOptionException e) {
			logger.severe("invalid arguments: " + e.getMessage());
			return false;
		} catch (GoToCException | IOException e) {
			logger.severe(e.getMessage());
			return false;
		}

		return true;
	}
}
