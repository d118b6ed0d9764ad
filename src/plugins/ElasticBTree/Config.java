/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree;

import java.io.File;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/**
** Settings for the command-line tool, read from environment variables. An
** unset or empty variable takes its default.
**
** || Variable       || Default         || Meaning ||
** | TREE_DEGREE     | 3               | minimum degree of a new tree, at least 2 |
** | STORAGE_PATH    | data/tree.yml   | snapshot file |
** | LOG_LEVEL       | info            | one of debug, info, warn, error |
**
** @author infinity0
*/
public class Config {

	final public static String ENV_DEGREE = "TREE_DEGREE";
	final public static String ENV_STORAGE_PATH = "STORAGE_PATH";
	final public static String ENV_LOG_LEVEL = "LOG_LEVEL";

	final public static int DEFAULT_DEGREE = 3;
	final public static String DEFAULT_STORAGE_PATH = "data/tree.yml";
	final public static String DEFAULT_LOG_LEVEL = "info";

	final protected int degree;
	final protected File storagePath;
	final protected Level logLevel;

	public Config(int deg, File path, Level level) {
		degree = deg;
		storagePath = path;
		logLevel = level;
	}

	/**
	** Reads the settings from the given variables.
	**
	** @throws ConfigException if any setting has an invalid value
	*/
	public static Config load(Map<String, String> env) throws ConfigException {
		if (env == null) { env = Collections.<String, String>emptyMap(); }

		int deg = DEFAULT_DEGREE;
		String s = get(env, ENV_DEGREE);
		if (s != null) {
			try {
				deg = Integer.parseInt(s.trim());
			} catch (NumberFormatException e) {
				throw new ConfigException(ENV_DEGREE, "not an integer: " + s, e);
			}
			if (deg < 2) {
				throw new ConfigException(ENV_DEGREE, "must be at least 2, got " + deg);
			}
		}

		String path = get(env, ENV_STORAGE_PATH);
		if (path == null) { path = DEFAULT_STORAGE_PATH; }

		String lvl = get(env, ENV_LOG_LEVEL);
		Level level = parseLevel((lvl == null)? DEFAULT_LOG_LEVEL: lvl);

		return new Config(deg, new File(path), level);
	}

	private static String get(Map<String, String> env, String name) {
		String s = env.get(name);
		return (s == null || s.isEmpty())? null: s;
	}

	/**
	** Maps a level name to a {@link Level}: debug to {@link Level#FINE}, info
	** to {@link Level#INFO}, warn to {@link Level#WARNING} and error to {@link
	** Level#SEVERE}. Case is ignored.
	**
	** @throws ConfigException if the name is none of these
	*/
	public static Level parseLevel(String name) throws ConfigException {
		String n = name.trim().toLowerCase(Locale.ROOT);
		if (n.equals("debug")) { return Level.FINE; }
		if (n.equals("info")) { return Level.INFO; }
		if (n.equals("warn")) { return Level.WARNING; }
		if (n.equals("error")) { return Level.SEVERE; }
		throw new ConfigException(ENV_LOG_LEVEL, "unknown level " + name + ", expected one of debug, info, warn, error");
	}

	public int getDegree() {
		return degree;
	}

	public File getStoragePath() {
		return storagePath;
	}

	public Level getLogLevel() {
		return logLevel;
	}

	@Override public String toString() {
		return "Config(degree=" + degree + ", storage=" + storagePath + ", log=" + logLevel + ")";
	}

}
