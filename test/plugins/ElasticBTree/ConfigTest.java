/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree;

import junit.framework.TestCase;

import java.io.File;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;

/**
** @author infinity0
*/
public class ConfigTest extends TestCase {

	private static Map<String, String> env(String... kv) {
		Map<String, String> map = new HashMap<String, String>();
		for (int i=0; i<kv.length; i+=2) {
			map.put(kv[i], kv[i+1]);
		}
		return map;
	}

	private static void assertRejected(String name, String value) {
		try {
			Config.load(env(name, value));
			fail(name + "=" + value + " should be rejected");
		} catch (ConfigException e) {
			assertEquals(name, e.getSetting());
		}
	}

	public void testDefaults() throws ConfigException {
		Config c = Config.load(env());
		assertEquals(3, c.getDegree());
		assertEquals(new File("data/tree.yml"), c.getStoragePath());
		assertEquals(Level.INFO, c.getLogLevel());

		// empty means unset
		c = Config.load(env("TREE_DEGREE", "", "STORAGE_PATH", "", "LOG_LEVEL", ""));
		assertEquals(3, c.getDegree());
		assertEquals(new File("data/tree.yml"), c.getStoragePath());
		assertEquals(Level.INFO, c.getLogLevel());
	}

	public void testOverrides() throws ConfigException {
		Config c = Config.load(env("TREE_DEGREE", "7", "STORAGE_PATH", "/tmp/x/snap.yml", "LOG_LEVEL", "debug"));
		assertEquals(7, c.getDegree());
		assertEquals(new File("/tmp/x/snap.yml"), c.getStoragePath());
		assertEquals(Level.FINE, c.getLogLevel());
		assertEquals(2, Config.load(env("TREE_DEGREE", "2")).getDegree());
	}

	public void testLevels() throws ConfigException {
		assertEquals(Level.FINE, Config.parseLevel("DEBUG"));
		assertEquals(Level.INFO, Config.parseLevel("Info"));
		assertEquals(Level.WARNING, Config.parseLevel("warn"));
		assertEquals(Level.SEVERE, Config.parseLevel("ERROR"));
	}

	public void testRejected() {
		assertRejected("TREE_DEGREE", "1");
		assertRejected("TREE_DEGREE", "-4");
		assertRejected("TREE_DEGREE", "three");
		assertRejected("TREE_DEGREE", "2.5");
		assertRejected("LOG_LEVEL", "verbose");
		assertRejected("LOG_LEVEL", "warning");
	}

}
