package edu.isi.wfst;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.util.Iterator;

import com.martiansoftware.jsap.FlaggedOption;
import com.martiansoftware.jsap.JSAP;
import com.martiansoftware.jsap.JSAPException;
import com.martiansoftware.jsap.JSAPResult;
import com.martiansoftware.jsap.Switch;
import com.martiansoftware.jsap.UnflaggedOption;
import com.martiansoftware.jsap.stringparsers.EnumeratedStringParser;
import com.martiansoftware.jsap.stringparsers.FileStringParser;
import com.martiansoftware.jsap.stringparsers.FloatStringParser;
import com.martiansoftware.jsap.stringparsers.StringStringParser;

// converts files of sparse tuple weights between text and binary, optionally reversing or quantizing them
public class SparseWeightTool {
	static final String VERSION = "1.0";

	// everything having to do with the JSAP parameters
	private static JSAPResult processParameters(JSAP jsap, String[] argv) throws JSAPException {

		Switch helpsw = new Switch("help",
				'h',
				"help",
				"print this help message");
		jsap.registerParameter(helpsw);

		Switch listsw = new Switch("list",
				'l',
				"list",
				"list the registered semirings and exit");
		jsap.registerParameter(listsw);

		FlaggedOption encodingopt = new FlaggedOption("encoding",
				StringStringParser.getParser(),
				"utf-8",
				true,
				'e',
				"encoding",
				"encoding of text input and output, if other than utf-8");
		jsap.registerParameter(encodingopt);

		// element semiring of the tuples; any registered name works
		FlaggedOption semiringopt = new FlaggedOption("semiring",
				StringStringParser.getParser(),
				TropicalSemiring.NAME,
				true,
				'm',
				"semiring",
				"semiring of the tuple elements: "+TropicalSemiring.NAME+", "+LogSemiring.NAME+", "+RealSemiring.NAME+
				", or a name provided by a plugin");
		jsap.registerParameter(semiringopt);

		FlaggedOption informatopt = new FlaggedOption("informat",
				EnumeratedStringParser.getParser("text; binary"),
				"text",
				true,
				'i',
				"input-format",
				"text (one weight per line) or binary");
		jsap.registerParameter(informatopt);

		FlaggedOption outformatopt = new FlaggedOption("outformat",
				EnumeratedStringParser.getParser("text; binary"),
				"text",
				true,
				'o',
				"output-format",
				"text (one weight per line) or binary");
		jsap.registerParameter(outformatopt);

		Switch reversesw = new Switch("reverse",
				'r',
				"reverse",
				"reverse each weight");
		jsap.registerParameter(reversesw);

		FlaggedOption quantizeopt = new FlaggedOption("quantize",
				FloatStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				'q',
				"quantize",
				"quantize each weight's stored elements to this step");
		jsap.registerParameter(quantizeopt);

		FlaggedOption pluginopt = new FlaggedOption("plugindir",
				FileStringParser.getParser(),
				JSAP.NO_DEFAULT,
				false,
				JSAP.NO_SHORTFLAG,
				"plugin-dir",
				"directory holding <name>-semiring.jar plugins. Plugins are only loaded if this is set");
		jsap.registerParameter(pluginopt);

		UnflaggedOption infileopt = new UnflaggedOption("infile",
				StringStringParser.getParser(),
				"-",
				false,
				false,
				"input file, or - for stdin");
		jsap.registerParameter(infileopt);

		UnflaggedOption outfileopt = new UnflaggedOption("outfile",
				StringStringParser.getParser(),
				"-",
				false,
				false,
				"output file, or - for stdout");
		jsap.registerParameter(outfileopt);

		return jsap.parse(argv);
	}

	public static void main(String argv[]) {
		System.exit(run(argv, System.in, System.out));
	}

	// the whole tool. returns the exit status
	public static int run(String argv[], InputStream stdin, OutputStream stdout) {
		boolean debug = false;
		JSAP jsap = new JSAP();
		JSAPResult config = null;
		try {
			config = processParameters(jsap, argv);
		}
		catch (JSAPException e) {
			Debug.prettyDebug("Options improperly configured: "+e.getMessage());
			return 1;
		}
		if (config.getBoolean("help")) {
			Debug.prettyDebug("This is SparseWeightTool, version "+VERSION);
			Debug.prettyDebug("Usage: sparseweight "+jsap.getUsage());
			Debug.prettyDebug("");
			Debug.prettyDebug(jsap.getHelp());
			return 0;
		}
		if (!config.success()) {
			for (Iterator<?> errs = config.getErrorMessageIterator(); errs.hasNext();)
				Debug.prettyDebug("Error: "+errs.next());
			Debug.prettyDebug("Usage: sparseweight "+jsap.getUsage());
			return 1;
		}

		String encoding = config.getString("encoding");
		Debug.setEncoding(encoding);
		try {
			if (config.contains("plugindir")) {
				File dir = config.getFile("plugindir");
				if (!dir.isDirectory())
					throw new ConfigureException("Plugin directory "+dir+" is not a directory");
				GenericRegister.setPluginDirectory(dir);
				GenericRegister.setPluginLoading(true);
			}
			SemiringRegister register = SemiringRegister.getRegister();
			if (config.getBoolean("list")) {
				Writer w = new OutputStreamWriter(stdout, encoding);
				for (String name : register.getKeys())
					w.write(name+"\n");
				w.flush();
				return 0;
			}
			Semiring<?> semiring = register.getEntry(config.getString("semiring"));
			if (semiring == null)
				throw new ConfigureException("Unknown semiring "+config.getString("semiring")+"; known semirings are "+register.getKeys());
			if (debug) Debug.debug(debug, "Using semiring "+semiring);
			Float delta = config.contains("quantize") ? config.getFloat("quantize") : null;
			if (delta != null && !(delta > 0))
				throw new ConfigureException("Quantization step must be positive, got "+delta);
			return convert(semiring, config, encoding, delta, stdin, stdout);
		}
		catch (ConfigureException e) {
			Debug.prettyDebug("Options improperly configured: "+e.getMessage());
			return 1;
		}
		catch (FileNotFoundException e) {
			Debug.prettyDebug("File not found: "+e.getMessage());
			return 1;
		}
		catch (DataFormatException e) {
			Debug.prettyDebug("Syntax error while reading weights: "+e.getMessage());
			return 1;
		}
		catch (IOException e) {
			Debug.prettyDebug("Problem processing weights: "+e.getMessage());
			return 1;
		}
	}

	// read, transform, write. One weight at a time
	private static <W extends Weight<W>> int convert(Semiring<W> semiring, JSAPResult config, String encoding, Float delta,
													 InputStream stdin, OutputStream stdout) throws IOException, DataFormatException {
		String infile = config.getString("infile");
		String outfile = config.getString("outfile");
		boolean binaryIn = config.getString("informat").equals("binary");
		boolean binaryOut = config.getString("outformat").equals("binary");
		boolean reverse = config.getBoolean("reverse");
		boolean debug = false;

		InputStream in = stdin;
		OutputStream out = stdout;
		int count = 0;
		try {
			if (!infile.equals("-"))
				in = new FileInputStream(infile);
			if (!outfile.equals("-"))
				out = new FileOutputStream(outfile);
			WeightSink<W> sink = binaryOut ? new BinarySink<W>(out) : new TextSink<W>(out, encoding);
			if (binaryIn) {
				BufferedInputStream bin = new BufferedInputStream(in);
				DataInputStream din = new DataInputStream(bin);
				while (true) {
					bin.mark(1);
					if (bin.read() < 0)
						break;
					bin.reset();
					sink.put(transform(SparseTupleWeight.read(din, semiring), reverse, delta));
					count++;
				}
			}
			else {
				BufferedReader br = new BufferedReader(new InputStreamReader(in, encoding));
				String line;
				int lineNo = 0;
				while ((line = br.readLine()) != null) {
					lineNo++;
					if (line.trim().length() == 0)
						continue;
					try {
						sink.put(transform(SparseTupleWeight.parse(line, semiring), reverse, delta));
					}
					catch (DataFormatException e) {
						throw new DataFormatException("line "+lineNo+": "+e.getMessage(), e);
					}
					count++;
				}
			}
			sink.flush();
		}
		finally {
			try {
				if (in != stdin)
					in.close();
			}
			finally {
				if (out != stdout)
					out.close();
			}
		}
		if (debug) Debug.debug(debug, "Converted "+count+" weights");
		return 0;
	}

	private static <W extends Weight<W>> SparseTupleWeight<W> transform(SparseTupleWeight<W> w, boolean reverse, Float delta) {
		if (reverse)
			w = w.reverse();
		if (delta != null)
			w = w.quantize(delta);
		return w;
	}

	private interface WeightSink<W extends Weight<W>> {
		void put(SparseTupleWeight<W> w) throws IOException;
		void flush() throws IOException;
	}

	private static class BinarySink<W extends Weight<W>> implements WeightSink<W> {
		private final DataOutputStream out;
		BinarySink(OutputStream o) { out = new DataOutputStream(new BufferedOutputStream(o)); }
		public void put(SparseTupleWeight<W> w) throws IOException { w.write(out); }
		public void flush() throws IOException { out.flush(); }
	}

	private static class TextSink<W extends Weight<W>> implements WeightSink<W> {
		private final Writer out;
		TextSink(OutputStream o, String encoding) throws IOException { out = new OutputStreamWriter(o, encoding); }
		public void put(SparseTupleWeight<W> w) throws IOException { out.write(w+"\n"); }
		public void flush() throws IOException { out.flush(); }
	}
}
