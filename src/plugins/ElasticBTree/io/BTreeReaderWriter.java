/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io;

import plugins.ElasticBTree.util.BTree;

import java.io.InputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Comparator;
import java.util.Map;

/**
** Reads and writes a whole {@link BTree} as a YAML snapshot. Writing holds
** the tree's read lock for the duration of the encoding; see {@link
** BTree#writeSnapshot(ObjectStreamWriter, OutputStream)}.
**
** Keys and values must be plain data that {@link YamlReaderWriter} can
** represent. The comparator is not stored, so the same one must be given
** here for reading.
**
** @author infinity0
*/
public class BTreeReaderWriter<K, V>
implements ObjectStreamReader<BTree<K, V>>, ObjectStreamWriter<BTree<K, V>> {

	final protected YamlReaderWriter yaml;
	final protected Comparator<? super K> comparator;

	public BTreeReaderWriter(Comparator<? super K> cmp) {
		yaml = new YamlReaderWriter();
		comparator = cmp;
	}

	/**
	** Uses the keys' natural ordering.
	*/
	public BTreeReaderWriter() {
		this(null);
	}

	@SuppressWarnings("unchecked")
	/*@Override**/ public BTree<K, V> readObject(InputStream is) throws IOException {
		Object o = yaml.readObject(is);
		if (!(o instanceof Map)) {
			throw new DataFormatException("Snapshot is not a mapping: " + o, null);
		}
		return BTree.<K, V>fromSnapshot((Map<String, Object>)o, comparator);
	}

	/*@Override**/ public void writeObject(BTree<K, V> tree, OutputStream os) throws IOException {
		tree.writeSnapshot(yaml, os);
	}

}
