/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree;

import plugins.ElasticBTree.io.BTreeReaderWriter;
import plugins.ElasticBTree.io.serial.FileArchiver;
import plugins.ElasticBTree.io.serial.Serialiser.*;
import plugins.ElasticBTree.util.BTree;
import plugins.ElasticBTree.util.ValidationReport;
import plugins.ElasticBTree.util.exec.TaskAbortException;

import java.io.PrintStream;
import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
** Command-line front end. Each run loads the tree from the snapshot file,
** performs one command, and saves the tree again if the command changed it.
** Keys are integers and values are strings.
**
** @author infinity0
*/
public class Main {

	private static final Logger logger = Logger.getLogger(Main.class.getName());

	/**
	** Root of the logger hierarchy for this program. Held here so that the
	** handler set up by {@link #configureLogging(Level)} is not lost when the
	** logger is garbage-collected.
	*/
	private static Logger baseLogger;

	final public static String USAGE =
	    "Usage: Main <command> [arguments]\n"
	  + "Commands:\n"
	  + "  insert <key> <value> - Insert a key-value pair\n"
	  + "  delete <key>         - Delete a key\n"
	  + "  search <key>         - Search for a key\n"
	  + "  save                 - Save tree to disk\n"
	  + "  load                 - Load tree from disk\n"
	  + "  print                - Print tree structure\n"
	  + "  validate             - Validate tree properties";

	final protected Config config;
	final protected PrintStream out;
	final protected PrintStream err;
	final protected FileArchiver<BTree<Integer, String>> archiver;

	protected BTree<Integer, String> tree;

	public Main(Config c, PrintStream o, PrintStream e) {
		config = c;
		out = o;
		err = e;
		archiver = new FileArchiver<BTree<Integer, String>>(new BTreeReaderWriter<Integer, String>());
	}

	/**
	** Runs a single command.
	**
	** @param args The command name followed by its arguments
	** @return The process exit status: 0 on success, 1 otherwise
	*/
	public int run(String[] args) {
		if (args.length < 1) {
			err.println(USAGE);
			return 1;
		}

		String command = args[0];
		if (!isCommand(command)) {
			err.println("Unknown command: " + command);
			err.println(USAGE);
			return 1;
		}

		try {
			if (command.equals("load")) {
				tree = pull();
				out.println("Tree loaded from " + config.getStoragePath() + " (degree=" + tree.degree() + ", size=" + tree.size() + ")");
				return 0;
			}
			tree = loadOrCreate();

			if (command.equals("insert")) {
				if (args.length < 3) {
					err.println("insert requires a key and a value");
					err.println("Example: Main insert 42 \"example value\"");
					return 1;
				}
				int key = parseKey(args[1]);
				tree.insert(key, args[2]);
				out.println("Inserted key " + key + " with value: " + args[2]);
				save();

			} else if (command.equals("delete")) {
				if (args.length < 2) {
					err.println("delete requires a key");
					return 1;
				}
				int key = parseKey(args[1]);
				if (tree.delete(key)) {
					out.println("Deleted key " + key);
					save();
				} else {
					out.println("Key " + key + " not found");
				}

			} else if (command.equals("search")) {
				if (args.length < 2) {
					err.println("search requires a key");
					return 1;
				}
				int key = parseKey(args[1]);
				Map.Entry<Integer, String> en = tree.search(key);
				if (en != null) {
					out.println("Found key " + key + ": " + en.getValue());
				} else {
					out.println("Key " + key + " not found");
				}

			} else if (command.equals("save")) {
				save();

			} else if (command.equals("print")) {
				out.print(tree.toTreeString());

			} else if (command.equals("validate")) {
				ValidationReport report = tree.validateTree();
				if (!report.isValid()) {
					err.println("Tree validation failed:");
					for (String p: report.getProblems()) {
						err.println("  " + p);
					}
					return 1;
				}
				out.println("Tree validation successful");
			}
			return 0;

		} catch (NumberFormatException e) {
			err.println("Invalid key: " + e.getMessage() + "; key must be an integer");
			return 1;
		} catch (TaskAbortException e) {
			logger.log(Level.SEVERE, e.getMessage(), e);
			err.println("Error: " + e.getMessage());
			return 1;
		}
	}

	private static boolean isCommand(String s) {
		return s.equals("insert") || s.equals("delete") || s.equals("search") || s.equals("save")
		    || s.equals("load") || s.equals("print") || s.equals("validate");
	}

	private static int parseKey(String s) {
		return Integer.parseInt(s.trim());
	}

	/**
	** Loads the tree from the snapshot file, or starts a new empty tree if
	** there is no snapshot yet. A tree that was loaded keeps the degree it was
	** saved with.
	*/
	protected BTree<Integer, String> loadOrCreate() throws TaskAbortException {
		try {
			BTree<Integer, String> t = pull();
			logger.info("Tree loaded from " + config.getStoragePath());
			return t;
		} catch (TaskAbortException e) {
			if (e.isError()) { throw e; }
			logger.info("No existing tree found at " + config.getStoragePath() + ", creating a new one with degree " + config.getDegree());
			return new BTree<Integer, String>(config.getDegree());
		}
	}

	protected BTree<Integer, String> pull() throws TaskAbortException {
		PullTask<BTree<Integer, String>> task = new PullTask<BTree<Integer, String>>(config.getStoragePath());
		archiver.pull(task);
		return task.data;
	}

	protected void save() throws TaskAbortException {
		archiver.push(new PushTask<BTree<Integer, String>>(tree, config.getStoragePath()));
		out.println("Tree saved to " + config.getStoragePath());
	}

	/**
	** Sends all log records of this program at or above the given level to
	** stderr.
	*/
	public static synchronized void configureLogging(Level level) {
		Logger base = Logger.getLogger("plugins.ElasticBTree");
		for (Handler h: base.getHandlers()) {
			base.removeHandler(h);
		}
		Handler handler = new ConsoleHandler();
		handler.setLevel(level);
		base.addHandler(handler);
		base.setLevel(level);
		base.setUseParentHandlers(false);
		baseLogger = base;
	}

	/**
	** Reads the configuration from the given variables, sets up logging, and
	** runs a single command.
	**
	** @return The process exit status
	*/
	public static int launch(Map<String, String> env, String[] args, PrintStream out, PrintStream err) {
		Config config;
		try {
			config = Config.load(env);
		} catch (ConfigException e) {
			err.println("Error loading config: invalid " + e.getSetting() + ": " + e.getMessage());
			return 1;
		}
		configureLogging(config.getLogLevel());
		return new Main(config, out, err).run(args);
	}

	public static void main(String[] argv) {
		System.exit(launch(System.getenv(), argv, System.out, System.err));
	}

}
