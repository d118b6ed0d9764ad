/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.util;

import junit.framework.TestCase;

import plugins.ElasticBTree.io.BTreeReaderWriter;
import plugins.ElasticBTree.io.serial.FileArchiver;
import plugins.ElasticBTree.io.serial.Serialiser.*;
import plugins.ElasticBTree.util.exec.TaskAbortException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.*;

/**
** Large trees with wide nodes. The full integrity check is switched off per
** operation and run between batches instead.
**
** @author infinity0
*/
public class BTreeBulkTest extends TestCase {

	final public static int DEGREE = 100;
	final public static int NUM_KEYS = 100000;
	final public static int BATCH = 10000;

	File dir;

	@Override public void setUp() throws IOException {
		dir = Files.createTempDirectory("elastic-btree-bulk").toFile();
	}

	@Override public void tearDown() {
		File[] sub = dir.listFiles();
		if (sub != null) {
			for (File s: sub) { s.delete(); }
		}
		dir.delete();
	}

	private static BTree<Integer, String> newTree() {
		BTree<Integer, String> tree = new BTree<Integer, String>(DEGREE);
		tree.checkIntegrity = false;
		return tree;
	}

	public void testSequentialInsertSearchDelete() {
		BTree<Integer, String> tree = newTree();
		try {
			for (int i=0; i<NUM_KEYS; ++i) {
				tree.insert(i, "v" + i);
				if ((i+1) % BATCH == 0) { tree.verifyTreeIntegrity(); }
			}
			assertEquals(NUM_KEYS, tree.size());
			assertTrue(tree.height() <= 3);

			for (int i=0; i<NUM_KEYS; ++i) {
				assertEquals("v" + i, tree.get(i));
			}
			assertNull(tree.search(NUM_KEYS));
			assertNull(tree.search(-1));

			List<Integer> keys = new ArrayList<Integer>(NUM_KEYS);
			for (int i=0; i<NUM_KEYS; ++i) { keys.add(i); }
			Collections.shuffle(keys, new Random(0xb7ee));

			int n = 0;
			for (int k: keys) {
				int h = tree.height();
				assertTrue(tree.delete(k));
				assertTrue(h - tree.height() <= 1);
				if (++n % BATCH == 0) {
					tree.verifyTreeIntegrity();
					assertEquals(NUM_KEYS - n, tree.size());
				}
			}
			tree.verifyTreeIntegrity();
			assertEquals(0, tree.size());
			assertEquals(0, tree.height());

		} catch (AssertionError e) {
			System.out.println(tree.toTreeString());
			throw e;
		}
	}

	public void testRandomInsert() {
		BTree<Integer, String> tree = newTree();
		Random rand = new Random(0x5eed);
		int[] counts = new int[NUM_KEYS * 2];

		for (int i=0; i<NUM_KEYS; ++i) {
			int k = rand.nextInt(NUM_KEYS * 2);
			tree.insert(k, "v" + k);
			++counts[k];
			if ((i+1) % BATCH == 0) { tree.verifyTreeIntegrity(); }
		}
		assertEquals(NUM_KEYS, tree.size());
		for (int k=0; k<counts.length; ++k) {
			assertEquals(counts[k] > 0, tree.containsKey(k));
		}
		assertTrue(tree.validateTree().isValid());
	}

	public void testBulkInsertWithPeriodicSave() throws TaskAbortException {
		File file = new File(dir, "bulk.yml");
		FileArchiver<BTree<Integer, String>> arx = new FileArchiver<BTree<Integer, String>>(new BTreeReaderWriter<Integer, String>());
		BTree<Integer, String> tree = newTree();

		for (int i=0; i<NUM_KEYS; ++i) {
			tree.insert(i, "v" + i);
			if (i % BATCH == 0) {
				arx.push(new PushTask<BTree<Integer, String>>(tree, file));
			}
		}
		arx.push(new PushTask<BTree<Integer, String>>(tree, file));

		PullTask<BTree<Integer, String>> task = new PullTask<BTree<Integer, String>>(file);
		arx.pull(task);
		BTree<Integer, String> copy = task.data;
		copy.verifyTreeIntegrity();
		assertEquals(DEGREE, copy.degree());
		assertEquals(NUM_KEYS, copy.size());
		assertEquals(tree.height(), copy.height());
		assertEquals("v0", copy.get(0));
		assertEquals("v" + (NUM_KEYS - 1), copy.get(NUM_KEYS - 1));
	}

}
