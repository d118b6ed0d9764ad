/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io.serial;

import junit.framework.TestCase;

import plugins.ElasticBTree.io.BTreeReaderWriter;
import plugins.ElasticBTree.io.DataFormatException;
import plugins.ElasticBTree.io.ObjectStreamWriter;
import plugins.ElasticBTree.io.serial.Serialiser.*;
import plugins.ElasticBTree.util.BTree;
import plugins.ElasticBTree.util.exec.TaskAbortException;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.*;

/**
** @author infinity0
*/
public class FileArchiverTest extends TestCase {

	File dir;

	@Override public void setUp() throws IOException {
		dir = Files.createTempDirectory("elastic-btree").toFile();
	}

	@Override public void tearDown() {
		deleteAll(dir);
	}

	private static void deleteAll(File f) {
		File[] sub = f.listFiles();
		if (sub != null) {
			for (File s: sub) { deleteAll(s); }
		}
		f.delete();
	}

	private static FileArchiver<BTree<Integer, String>> archiver(Comparator<Integer> cmp) {
		return new FileArchiver<BTree<Integer, String>>(new BTreeReaderWriter<Integer, String>(cmp));
	}

	private static BTree<Integer, String> pull(FileArchiver<BTree<Integer, String>> arx, File file) throws TaskAbortException {
		PullTask<BTree<Integer, String>> task = new PullTask<BTree<Integer, String>>(file);
		arx.pull(task);
		return task.data;
	}

	private void write(File file, String text) throws IOException {
		OutputStream os = new FileOutputStream(file);
		try {
			os.write(text.getBytes("UTF-8"));
		} finally {
			os.close();
		}
	}

	private void assertMalformed(File file) {
		try {
			pull(archiver(null), file);
			fail("malformed snapshot should be rejected");
		} catch (ArchiveNotFoundException e) {
			fail("malformed snapshot reported as missing");
		} catch (TaskAbortException e) {
			assertTrue(e.getCause() instanceof DataFormatException);
			assertFalse(e.isRetry());
		}
	}

	public void testRoundTrip() throws TaskAbortException {
		for (int degree=2; degree<=5; ++degree) {
			Random rand = new Random(degree);
			BTree<Integer, String> tree = new BTree<Integer, String>(degree);
			for (int i=0; i<0x200; ++i) {
				int k = rand.nextInt(0x100);
				tree.insert(k, "value " + k + " #" + i);
			}
			for (int i=0; i<0x40; ++i) {
				tree.delete(rand.nextInt(0x100));
			}

			File file = new File(dir, "tree-" + degree + ".yml");
			FileArchiver<BTree<Integer, String>> arx = archiver(null);
			arx.push(new PushTask<BTree<Integer, String>>(tree, file));
			BTree<Integer, String> copy = pull(arx, file);

			assertEquals(degree, copy.degree());
			assertEquals(tree.size(), copy.size());
			assertEquals(tree.height(), copy.height());
			assertEquals(tree.toTreeString(), copy.toTreeString());
			assertTrue(copy.validateTree().isValid());
			for (int k=0; k<0x100; ++k) {
				assertEquals(tree.get(k), copy.get(k));
			}

			// the loaded tree is fully usable
			copy.insert(0x1000, "new");
			assertTrue(copy.delete(0x1000));
			assertTrue(copy.validateTree().isValid());
		}
	}

	public void testEmptyTree() throws TaskAbortException {
		File file = new File(dir, "empty.yml");
		FileArchiver<BTree<Integer, String>> arx = archiver(null);
		arx.push(new PushTask<BTree<Integer, String>>(new BTree<Integer, String>(4), file));
		BTree<Integer, String> copy = pull(arx, file);
		assertTrue(copy.isEmpty());
		assertEquals(0, copy.height());
		assertEquals(4, copy.degree());
	}

	public void testComparatorIsReinstalled() throws TaskAbortException {
		Comparator<Integer> rev = Collections.<Integer>reverseOrder();
		BTree<Integer, String> tree = new BTree<Integer, String>(rev, 2);
		for (int k=1; k<=20; ++k) {
			tree.insert(k, "v" + k);
		}
		File file = new File(dir, "reverse.yml");
		archiver(rev).push(new PushTask<BTree<Integer, String>>(tree, file));

		BTree<Integer, String> copy = pull(archiver(rev), file);
		assertEquals(Integer.valueOf(20), copy.firstKey());
		assertEquals(Integer.valueOf(1), copy.lastKey());
		copy.insert(21, "v21");
		assertEquals(Integer.valueOf(21), copy.firstKey());

		// the same data does not describe a valid tree under the natural order
		assertMalformed(file);
	}

	public void testMissing() {
		File file = new File(dir, "nothing-here.yml");
		try {
			pull(archiver(null), file);
			fail("missing snapshot should be reported");
		} catch (ArchiveNotFoundException e) {
			assertEquals(file, e.getMeta());
			assertFalse(e.isError());
		} catch (TaskAbortException e) {
			fail("missing snapshot reported as " + e);
		}
	}

	public void testMalformed() throws IOException {
		File file = new File(dir, "bad.yml");

		write(file, "root: [unclosed\n");
		assertMalformed(file);

		write(file, "just a string\n");
		assertMalformed(file);

		write(file, "");
		assertMalformed(file);

		// size does not match the keys
		write(file, "root:\n  keys: [1, 2]\n  children: []\n  isLeaf: true\n  size: 3\n  maxKeys: 3\n  minKeys: 1\n  values: [a, b]\ndegree: 2\nsize: 2\nheight: 1\n");
		assertMalformed(file);

		// well-formed nodes but the tree size is wrong
		write(file, "root:\n  keys: [1, 2]\n  children: []\n  isLeaf: true\n  size: 2\n  maxKeys: 3\n  minKeys: 1\n  values: [a, b]\ndegree: 2\nsize: 5\nheight: 1\n");
		assertMalformed(file);

		// degree out of range
		write(file, "root: null\ndegree: 1\nsize: 0\nheight: 0\n");
		assertMalformed(file);
	}

	public void testValidSnapshotByHand() throws Exception {
		File file = new File(dir, "hand.yml");
		write(file, "root:\n  keys: [1, 2]\n  children: []\n  isLeaf: true\n  size: 2\n  maxKeys: 3\n  minKeys: 1\n  values: [a, b]\ndegree: 2\nsize: 2\nheight: 1\n");
		BTree<Integer, String> tree = pull(archiver(null), file);
		assertEquals("a", tree.get(1));
		assertEquals("b", tree.get(2));
	}

	public void testCreatesParentDirectories() throws TaskAbortException {
		File file = new File(dir, "a/b/c/tree.yml");
		BTree<Integer, String> tree = new BTree<Integer, String>(3);
		tree.insert(1, "one");
		archiver(null).push(new PushTask<BTree<Integer, String>>(tree, file));
		assertTrue(file.isFile());
		assertEquals("one", pull(archiver(null), file).get(1));
	}

	public void testDelete() throws TaskAbortException {
		File file = new File(dir, "tree.yml");
		FileArchiver<BTree<Integer, String>> arx = archiver(null);
		BTree<Integer, String> tree = new BTree<Integer, String>(3);
		tree.insert(1, "one");
		arx.push(new PushTask<BTree<Integer, String>>(tree, file));
		assertTrue(file.exists());

		arx.delete(file);
		assertFalse(file.exists());
		arx.delete(file);
		arx.delete(file.getPath());
	}

	public void testFailedPushKeepsPreviousArchive() throws TaskAbortException {
		File file = new File(dir, "tree.yml");
		BTree<Integer, String> tree = new BTree<Integer, String>(3);
		tree.insert(1, "one");
		archiver(null).push(new PushTask<BTree<Integer, String>>(tree, file));

		ObjectStreamWriter<BTree<Integer, String>> broken = new ObjectStreamWriter<BTree<Integer, String>>() {
			/*@Override**/ public void writeObject(BTree<Integer, String> o, OutputStream os) throws IOException {
				os.write("root:\n  keys: [".getBytes("UTF-8"));
				throw new IOException("disk full");
			}
		};
		FileArchiver<BTree<Integer, String>> arx = new FileArchiver<BTree<Integer, String>>(
			new BTreeReaderWriter<Integer, String>(), broken);
		tree.insert(2, "two");
		try {
			arx.push(new PushTask<BTree<Integer, String>>(tree, file));
			fail("push should fail");
		} catch (TaskAbortException e) {
			assertTrue(e.isRetry());
		}

		BTree<Integer, String> copy = pull(archiver(null), file);
		assertEquals(1, copy.size());
		assertEquals("one", copy.get(1));
		assertEquals(1, dir.listFiles().length);
	}

	public void testBadMeta() throws TaskAbortException {
		try {
			archiver(null).pull(new PullTask<BTree<Integer, String>>(Integer.valueOf(3)));
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
		try {
			new PullTask<BTree<Integer, String>>(null);
			fail();
		} catch (IllegalArgumentException e) {
			// expected
		}
	}

}
