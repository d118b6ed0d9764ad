/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.util;

import plugins.ElasticBTree.io.DataFormatException;
import plugins.ElasticBTree.io.ObjectStreamWriter;
import plugins.ElasticBTree.io.serial.Translator;

import java.io.IOException;
import java.io.OutputStream;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Queue;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
** In-memory B-tree index, mapping keys to values. Entries are held in every
** node, not only in the leaves.
**
** A B-tree of degree t satisfies the following properties:
**
** * Every node has between t-1 and 2t-1 entries, except for the root node,
**   which has between 1 and 2t-1 entries.
** * All leaves are the same distance from the root.
** * Every non-leaf node with k entries has k+1 subnodes, arranged in sorted
**   order between the entries (for details, see {@link Node}).
**
** Insertion is single-pass: any full node met on the way down is split
** before we enter it, so the leaf at the bottom always has room. Deletion is
** the other way round: the entry is removed first, and any node left with
** too few entries is repaired afterwards, by walking back up the {@link
** Node#parent} links and borrowing from or merging with a sibling.
**
** Duplicate keys are accepted. Each {@link #insert(Object, Object)} adds a
** new entry, and each {@link #delete(Object)} removes one.
**
** All public methods take a single tree-wide {@link ReentrantReadWriteLock};
** mutations in write mode, everything else in read mode. Internal methods
** never take the lock themselves.
**
** Structural checks come in two strengths. Local checks on the nodes touched
** by a split, borrow or merge always run. The full check over the whole tree
** runs before and after every mutation when assertions are enabled. Either
** one throws {@link IntegrityError} on failure. {@link #validateTree()} runs
** the full check on demand and reports the outcome instead of throwing.
**
** @author infinity0
** @see ValidationReport
*/
public class BTree<K, V> {

	private static final Logger logger = Logger.getLogger(BTree.class.getName());

	/**
	** Whether to run the full integrity check around each mutation. This
	** follows the assertion status of this class, ie. {@code -ea}.
	*/
	final static boolean CHECK_INTEGRITY = BTree.class.desiredAssertionStatus();

	/**
	** Per-tree switch for the full integrity check, initially {@link
	** #CHECK_INTEGRITY}. Each check walks the whole tree.
	*/
	boolean checkIntegrity = CHECK_INTEGRITY;

	/**
	** Minimum degree of the tree.
	*/
	final public int DEGREE;

	/**
	** Minimum number of entries in each non-root node. Equal to {@code
	** DEGREE - 1}.
	*/
	final public int ENT_MIN;

	/**
	** Maximum number of entries in each node. Equal to {@code 2*DEGREE - 1}.
	*/
	final public int ENT_MAX;

	/**
	** Comparator for the keys, or {@code null} for their natural ordering.
	*/
	final protected Comparator<? super K> comparator;

	/**
	** Root node of the tree, or {@code null} if the tree is empty. The only
	** node that can have less than ENT_MIN entries.
	*/
	protected Node root = null;

	/**
	** Number of entries currently in the tree, over all levels.
	*/
	protected int size = 0;

	/**
	** Number of node levels from the root to the leaves. 0 when empty.
	*/
	protected int height = 0;

	final private ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	/**
	** Creates a new empty tree, sorted according to the given comparator, with
	** the given minimum degree.
	**
	** @param cmp The comparator for the tree, or {@code null} to use the keys'
	**            {@link Comparable natural} ordering.
	** @param degree Minimum degree; every non-root node holds between {@code
	**        degree-1} and {@code 2*degree-1} entries
	** @throws IllegalArgumentException if {@code degree < 2}
	*/
	public BTree(Comparator<? super K> cmp, int degree) {
		if (degree < 2) {
			throw new IllegalArgumentException("The degree of a B-tree must be at least 2, got " + degree);
		}
		comparator = cmp;
		DEGREE = degree;
		ENT_MIN = degree - 1;
		ENT_MAX = (degree<<1) - 1;
	}

	/**
	** Creates a new empty tree, sorted according to the keys' {@link
	** Comparable natural} ordering, with the given minimum degree.
	*/
	public BTree(int degree) {
		this(null, degree);
	}

	/**
	** A B-tree node. It has the following structure:
	**
	**                 K1    K2    K3    K4
	**                 V1    V2    V3    V4
	**               /    |     |     |     \
	**            C0     C1    C2    C3     C4
	**
	** * {@link #keys} are in ascending order, and {@link #values} is parallel
	**   to it.
	** * A non-leaf node with k entries has k+1 {@link #children}. Every key in
	**   {@code Ci} lies between {@code K(i)} and {@code K(i+1)}.
	** * {@link #parent} points back at the node that owns this one. It is
	**   only used to walk upwards while rebalancing, and is never serialised.
	*/
	protected class Node {

		final protected boolean isLeaf;

		final protected List<K> keys;

		final protected List<V> values;

		/**
		** Subnodes, in key order. Always empty for a leaf.
		*/
		final protected List<Node> children;

		/**
		** The node whose {@link #children} contain this node, or {@code null}
		** for the root (and for nodes that have been merged away).
		*/
		protected Node parent;

		protected Node(boolean lf) {
			isLeaf = lf;
			keys = new ArrayList<K>(ENT_MAX);
			values = new ArrayList<V>(ENT_MAX);
			children = (lf)? Collections.<Node>emptyList(): new ArrayList<Node>(ENT_MAX + 1);
		}

		/**
		** @return Number of local entries
		*/
		public int nodeSize() {
			return keys.size();
		}

		public boolean isLeaf() {
			return isLeaf;
		}

		/**
		** @return Index of the first key that is not smaller than the given key
		*/
		protected int lowerBound(K key) {
			int lo = 0, hi = keys.size();
			while (lo < hi) {
				int mid = (lo + hi) >>> 1;
				if (compare(keys.get(mid), key) < 0) { lo = mid + 1; }
				else { hi = mid; }
			}
			return lo;
		}

		/**
		** @return Index of the first key that is strictly greater than the given
		**         key
		*/
		protected int upperBound(K key) {
			int lo = 0, hi = keys.size();
			while (lo < hi) {
				int mid = (lo + hi) >>> 1;
				if (compare(keys.get(mid), key) <= 0) { lo = mid + 1; }
				else { hi = mid; }
			}
			return lo;
		}

		@Override public String toString() {
			return keys.toString();
		}

	}

	/**
	** Compares two keys using the comparator for this tree, or the keys'
	** {@link Comparable natural} ordering if no comparator was given.
	**
	** @throws ClassCastException if the keys cannot be compared
	*/
	@SuppressWarnings("unchecked")
	public int compare(K key1, K key2) {
		return (comparator != null)? comparator.compare(key1, key2): ((Comparable<K>)key1).compareTo(key2);
	}

	protected Node newNode(boolean lf) {
		return new Node(lf);
	}

	/*========================================================================
	  integrity checks
	 ========================================================================*/

	/**
	** Logs the tree and throws. Only ever called for states that cannot arise
	** from any sequence of calls on a correct implementation.
	*/
	private void fail(String msg) {
		logger.severe("B-tree integrity violation: " + msg + "\n" + treeString());
		throw new IntegrityError(msg);
	}

	private void verify(boolean b, Node node, String msg) {
		if (!b) { fail(msg + " (node " + node + ")"); }
	}

	/**
	** Checks the local shape of a node:
	**
	** * the key and value lists are the same length
	** * the node has at most ENT_MAX entries
	** * a leaf has no subnodes, and a non-leaf node has one more subnode than
	**   entries, each of which points back at this node
	**
	** @throws IntegrityError if the constraints are not satisfied
	*/
	final void verifyNode(Node node) {
		verify(node.keys.size() == node.values.size(), node, "keys and values differ in length");
		verify(node.nodeSize() <= ENT_MAX, node, "node holds more than " + ENT_MAX + " entries");
		if (node.isLeaf) {
			verify(node.children.isEmpty(), node, "leaf has subnodes");
		} else {
			verify(node.children.size() == node.nodeSize() + 1, node,
			       "node has " + node.nodeSize() + " keys but " + node.children.size() + " subnodes");
			for (Node ch: node.children) {
				verify(ch.parent == node, node, "subnode " + ch + " does not point back to its parent");
			}
		}
	}

	/**
	** Package-private debugging method. Checks every structural constraint of
	** the whole tree; see {@link #inspect()}.
	**
	** @throws IntegrityError if the constraints are not satisfied
	*/
	final void verifyTreeIntegrity() {
		List<String> problems = inspect();
		if (!problems.isEmpty()) {
			fail(problems.toString());
		}
	}

	private void checkTree() {
		if (checkIntegrity) { verifyTreeIntegrity(); }
	}

	/**
	** Accumulator for {@link #inspect(Node, Object, Object, int, Inspection)}.
	*/
	private static class Inspection {
		final List<String> problems = new ArrayList<String>();
		int entries = 0;
		int leafDepth = -1;
	}

	/**
	** Walks the whole tree and collects every broken constraint:
	**
	** * shape of each node, as in {@link #verifyNode(Node)}
	** * occupancy: ENT_MIN to ENT_MAX entries, or 1 to ENT_MAX for the root
	** * ordering: keys ascending within each node, and every subnode's keys
	**   lying between the entries either side of it
	** * parent links agreeing with the subnode lists
	** * all leaves at depth {@link #height}
	** * the entry count agreeing with {@link #size}
	**
	** @return The problems found, or an empty list
	*/
	protected List<String> inspect() {
		Inspection in = new Inspection();
		if (root == null) {
			if (size != 0) { in.problems.add("empty tree reports size " + size); }
			if (height != 0) { in.problems.add("empty tree reports height " + height); }
			return in.problems;
		}

		if (root.parent != null) { in.problems.add("root " + root + " has a parent"); }
		if (root.nodeSize() == 0) { in.problems.add("root holds no entries"); }
		inspect(root, null, null, 1, in);

		if (in.entries != size) {
			in.problems.add("tree reports size " + size + " but holds " + in.entries + " entries");
		}
		if (in.leafDepth != height) {
			in.problems.add("tree reports height " + height + " but leaves are at depth " + in.leafDepth);
		}
		return in.problems;
	}

	/**
	** @param lo Separator to the left of the node, or {@code null} at the edge
	** @param hi Separator to the right of the node, or {@code null} at the edge
	*/
	private void inspect(Node node, K lo, K hi, int depth, Inspection in) {
		int n = node.nodeSize();
		in.entries += n;

		if (node.keys.size() != node.values.size()) {
			in.problems.add("node " + node + " has " + n + " keys but " + node.values.size() + " values");
		}
		if (n > ENT_MAX || node != root && n < ENT_MIN) {
			in.problems.add("node " + node + " holds " + n + " entries, outside [" + ENT_MIN + ", " + ENT_MAX + "]");
		}
		for (int i=0; i<n; ++i) {
			K key = node.keys.get(i);
			if (i > 0 && compare(node.keys.get(i-1), key) > 0) {
				in.problems.add("node " + node + " has keys out of order at position " + i);
			}
			// NULLNOTICE null bounds mean "edge of the tree"
			if (lo != null && compare(key, lo) < 0 || hi != null && compare(key, hi) > 0) {
				in.problems.add("key " + key + " in node " + node + " lies outside its range " + lo + "-" + hi);
			}
		}

		if (node.isLeaf) {
			if (!node.children.isEmpty()) {
				in.problems.add("leaf " + node + " has subnodes");
			}
			if (in.leafDepth < 0) {
				in.leafDepth = depth;
			} else if (in.leafDepth != depth) {
				in.problems.add("leaf " + node + " is at depth " + depth + ", expected " + in.leafDepth);
			}
			return;
		}

		if (node.children.size() != n + 1) {
			in.problems.add("node " + node + " has " + n + " keys but " + node.children.size() + " subnodes");
			return;
		}
		for (int i=0; i<=n; ++i) {
			Node ch = node.children.get(i);
			if (ch.parent != node) {
				in.problems.add("subnode " + ch + " of " + node + " does not point back to it");
			}
			inspect(ch, (i == 0)? lo: node.keys.get(i-1), (i == n)? hi: node.keys.get(i), depth + 1, in);
		}
	}

	/**
	** Checks the whole tree without throwing. Any problem is logged as a
	** warning and returned in the report.
	*/
	public ValidationReport validateTree() {
		lock.readLock().lock();
		try {
			List<String> problems = inspect();
			for (String p: problems) {
				logger.warning("Invalid B-tree: " + p);
			}
			return new ValidationReport(problems);
		} finally {
			lock.readLock().unlock();
		}
	}

	/*========================================================================
	  queries
	 ========================================================================*/

	public int size() {
		lock.readLock().lock();
		try {
			return size;
		} finally {
			lock.readLock().unlock();
		}
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	public int height() {
		lock.readLock().lock();
		try {
			return height;
		} finally {
			lock.readLock().unlock();
		}
	}

	public int degree() {
		return DEGREE;
	}

	public Comparator<? super K> comparator() {
		return comparator;
	}

	/**
	** Descends the tree looking for the given key.
	**
	** @return The stored key and its value, or {@code null} if the key is not
	**         in the tree
	** @throws IllegalArgumentException if the key is {@code null}
	** @throws ClassCastException key cannot be compared with the keys
	**         currently in the tree
	*/
	public Map.Entry<K, V> search(K key) {
		if (key == null) { throw new IllegalArgumentException("Sorry, this B-tree cannot hold null keys."); }
		lock.readLock().lock();
		try {
			Node node = root;
			while (node != null) {
				int i = node.lowerBound(key);
				if (i < node.nodeSize() && compare(node.keys.get(i), key) == 0) {
					return new AbstractMap.SimpleImmutableEntry<K, V>(node.keys.get(i), node.values.get(i));
				}
				if (node.isLeaf) { return null; }
				node = node.children.get(i);
			}
			return null;
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	** @return The value for the given key, or {@code null} if the key is
	**         absent (or mapped to {@code null})
	*/
	public V get(K key) {
		Map.Entry<K, V> en = search(key);
		return (en == null)? null: en.getValue();
	}

	public boolean containsKey(K key) {
		return search(key) != null;
	}

	public K firstKey() {
		lock.readLock().lock();
		try {
			if (root == null) { throw new NoSuchElementException("tree is empty"); }
			Node node = root;
			while (!node.isLeaf) { node = node.children.get(0); }
			return node.keys.get(0);
		} finally {
			lock.readLock().unlock();
		}
	}

	public K lastKey() {
		lock.readLock().lock();
		try {
			if (root == null) { throw new NoSuchElementException("tree is empty"); }
			Node node = root;
			while (!node.isLeaf) { node = node.children.get(node.nodeSize()); }
			return node.keys.get(node.nodeSize() - 1);
		} finally {
			lock.readLock().unlock();
		}
	}

	/*========================================================================
	  insertion
	 ========================================================================*/

	/**
	** Inserts an entry, using the B-tree single-pass insertion algorithm.
	**
	** If the root is full, it is first pushed down under a new empty root and
	** {@link #splitChild(Node, int) split}; this is the only way the tree
	** grows taller. Then we descend from the root. Before entering a full
	** subnode we split it, and re-select between the two halves, so that the
	** leaf we finally reach has room for one more entry.
	**
	** An entry whose key is already present is added next to the existing
	** one(s); nothing is replaced.
	**
	** @throws IllegalArgumentException if the key is {@code null}
	** @throws ClassCastException key cannot be compared with the keys
	**         currently in the tree
	*/
	public void insert(K key, V value) {
		if (key == null) { throw new IllegalArgumentException("Sorry, this B-tree cannot hold null keys."); }
		lock.writeLock().lock();
		try {
			if (root == null) {
				root = newNode(true);
				root.keys.add(key);
				root.values.add(value);
				size = 1;
				height = 1;
				if (logger.isLoggable(Level.FINE)) { logger.fine("insert: created new root with key " + key); }
				checkTree();
				return;
			}

			checkTree();
			if (logger.isLoggable(Level.FINE)) { logger.fine("insert: inserting key " + key); }

			if (root.nodeSize() == ENT_MAX) {
				Node oldroot = root;
				root = newNode(false);
				root.children.add(oldroot);
				oldroot.parent = root;
				splitChild(root, 0);
				++height;
				if (logger.isLoggable(Level.FINE)) { logger.fine("insert: root split, new root " + root); }
			}

			insertNonFull(root, key, value);
			++size;
			checkTree();
		} finally {
			lock.writeLock().unlock();
		}
	}

	/**
	** Inserts an entry into the subtree at the given node, which must not be
	** full.
	*/
	private void insertNonFull(Node node, K key, V value) {
		for (;;) {
			assert(node.nodeSize() < ENT_MAX);
			int i = node.upperBound(key);

			if (node.isLeaf) {
				node.keys.add(i, key);
				node.values.add(i, value);
				verifyNode(node);
				return;
			}

			if (node.children.get(i).nodeSize() == ENT_MAX) {
				splitChild(node, i);
				// the median may belong on either side of the key
				if (compare(node.keys.get(i), key) < 0) { ++i; }
			}
			node = node.children.get(i);
		}
	}

	/**
	** Split a maximal subnode into two minimal nodes, promoting the median
	** entry into the parent as the separator between them. The lower half
	** stays in the existing node; the upper half goes into a new node that is
	** attached directly after it.
	**
	** It is '''assumed''' that the parent is not full. It is up to the caller
	** to ensure that this holds.
	**
	** @param parent The node holding the subnode
	** @param index Position of the subnode within the parent
	*/
	protected void splitChild(Node parent, int index) {
		Node child = parent.children.get(index);
		verify(child.nodeSize() == ENT_MAX, child, "splitChild: subnode is not full");
		verify(parent.nodeSize() < ENT_MAX, parent, "splitChild: parent is full");
		if (logger.isLoggable(Level.FINER)) { logger.finer("splitChild: splitting subnode " + index + " " + child); }

		int m = ENT_MIN; // median position, DEGREE-1
		K mkey = child.keys.get(m);
		V mval = child.values.get(m);

		Node sibling = newNode(child.isLeaf);
		sibling.parent = parent;

		List<K> ukeys = child.keys.subList(m + 1, child.keys.size());
		sibling.keys.addAll(ukeys);
		ukeys.clear();
		List<V> uvalues = child.values.subList(m + 1, child.values.size());
		sibling.values.addAll(uvalues);
		uvalues.clear();
		child.keys.remove(m);
		child.values.remove(m);

		if (!child.isLeaf) {
			List<Node> unodes = child.children.subList(m + 1, child.children.size());
			for (Node n: unodes) {
				n.parent = sibling;
				sibling.children.add(n);
			}
			unodes.clear();
		}

		parent.keys.add(index, mkey);
		parent.values.add(index, mval);
		parent.children.add(index + 1, sibling);

		verifyNode(child);
		verifyNode(sibling);
		verifyNode(parent);
	}

	/*========================================================================
	  deletion
	 ========================================================================*/

	/**
	** Removes one entry with the given key.
	**
	** We descend to the node holding the key. In a leaf, the entry is simply
	** removed. In a non-leaf node, it is replaced by its predecessor or
	** successor, whichever lives in a subtree with entries to spare, and that
	** entry is removed from its leaf instead. If neither adjacent subnode can
	** spare an entry, the two are {@link #mergeChildren(Node, int) merged}
	** around the key, and we carry on in the merged node.
	**
	** Any node left with less than {@link #ENT_MIN} entries is then {@link
	** #rebalance(Node) rebalanced}, which may cascade up to the root; an
	** empty root is replaced by its only subnode.
	**
	** @return Whether an entry was removed; {@code false} if the key was not
	**         in the tree
	** @throws IllegalArgumentException if the key is {@code null}
	** @throws ClassCastException key cannot be compared with the keys
	**         currently in the tree
	*/
	public boolean delete(K key) {
		if (key == null) { throw new IllegalArgumentException("Sorry, this B-tree cannot hold null keys."); }
		lock.writeLock().lock();
		try {
			if (root == null) { return false; }
			checkTree();
			if (logger.isLoggable(Level.FINE)) { logger.fine("delete: deleting key " + key); }

			boolean removed = deleteFrom(root, key);
			if (removed) { --size; }
			collapseRoot();

			checkTree();
			if (logger.isLoggable(Level.FINE)) {
				logger.fine("delete: key " + key + (removed? " deleted": " not found"));
			}
			return removed;
		} finally {
			lock.writeLock().unlock();
		}
	}

	private boolean deleteFrom(Node node, K key) {
		int i = node.lowerBound(key);
		if (i < node.nodeSize() && compare(node.keys.get(i), key) == 0) {
			if (node.isLeaf) {
				removeFromLeaf(node, i);
			} else {
				deleteInternal(node, i);
			}
			return true;
		}
		if (node.isLeaf) { return false; }
		return deleteFrom(node.children.get(i), key);
	}

	/**
	** Removes the entry at the given position of a non-leaf node.
	*/
	private void deleteInternal(Node node, int index) {
		Node lnode = node.children.get(index);
		Node rnode = node.children.get(index + 1);
		if (logger.isLoggable(Level.FINER)) { logger.finer("deleteInternal: removing entry " + index + " of " + node); }

		if (lnode.nodeSize() > ENT_MIN) {
			Node pred = lnode;
			while (!pred.isLeaf) { pred = pred.children.get(pred.nodeSize()); }
			int last = pred.nodeSize() - 1;
			node.keys.set(index, pred.keys.get(last));
			node.values.set(index, pred.values.get(last));
			removeFromLeaf(pred, last);

		} else if (rnode.nodeSize() > ENT_MIN) {
			Node succ = rnode;
			while (!succ.isLeaf) { succ = succ.children.get(0); }
			node.keys.set(index, succ.keys.get(0));
			node.values.set(index, succ.values.get(0));
			removeFromLeaf(succ, 0);

		} else {
			// both are minimal; the entry ends up in the middle of the merged node
			Node merged = mergeChildren(node, index);
			int pos = ENT_MIN;
			if (merged.isLeaf) {
				removeFromLeaf(merged, pos);
			} else {
				deleteInternal(merged, pos);
			}
			// the merged node has entries to spare, so nothing below reaches us;
			// but we ourselves lost the separator
			if (node != root && node.nodeSize() < ENT_MIN) {
				rebalance(node);
			}
		}
	}

	private void removeFromLeaf(Node leaf, int index) {
		leaf.keys.remove(index);
		leaf.values.remove(index);
		verifyNode(leaf);
		if (leaf.nodeSize() < ENT_MIN) {
			rebalance(leaf);
		}
	}

	/**
	** Restores the minimum occupancy of a node that has just dropped below
	** {@link #ENT_MIN} entries. In order of preference:
	**
	** * borrow an entry from the L sibling, if it has any to spare
	** * borrow an entry from the R sibling, if it has any to spare
	** * merge with the L sibling, or with the R sibling if there is no L
	**
	** A merge takes an entry away from the parent, which is rebalanced in turn
	** if that leaves it short. The root needs no balancing, but is collapsed if
	** it becomes empty.
	*/
	protected void rebalance(Node node) {
		if (node == root) {
			collapseRoot();
			return;
		}
		if (node.nodeSize() >= ENT_MIN) { return; }

		Node parent = node.parent;
		verify(parent != null, node, "rebalance: detached non-root node");
		int index = childIndex(parent, node);

		if (index > 0 && parent.children.get(index - 1).nodeSize() > ENT_MIN) {
			borrowFromLeft(parent, index);
			return;
		}
		if (index < parent.children.size() - 1 && parent.children.get(index + 1).nodeSize() > ENT_MIN) {
			borrowFromRight(parent, index);
			return;
		}

		if (index > 0) {
			mergeChildren(parent, index - 1);
		} else {
			mergeChildren(parent, index);
		}

		if (parent == root) {
			collapseRoot();
		} else if (parent.nodeSize() < ENT_MIN) {
			rebalance(parent);
		}
	}

	/**
	** @return Position of the given node within its parent's subnodes
	** @throws IntegrityError if the node is not a subnode of the parent
	*/
	private int childIndex(Node parent, Node node) {
		for (int i=0; i<parent.children.size(); ++i) {
			if (parent.children.get(i) == node) { return i; }
		}
		fail("node " + node + " not found among the subnodes of its parent " + parent);
		throw new AssertionError(); // unreachable
	}

	/**
	** Performs a rotate operation towards the greater node. The separator in
	** the parent moves down to the front of the node, and the greatest entry
	** of the L sibling moves up to replace it. For non-leaf nodes, the L
	** sibling's greatest subnode moves across too.
	**
	** @param parent The parent of the node
	** @param index Position of the node, which accepts an entry
	*/
	private void borrowFromLeft(Node parent, int index) {
		verify(index > 0 && index < parent.children.size(), parent, "borrowFromLeft: bad index " + index);
		Node node = parent.children.get(index);
		Node lnode = parent.children.get(index - 1);
		if (logger.isLoggable(Level.FINER)) { logger.finer("borrowFromLeft: " + lnode + " -> " + node); }

		node.keys.add(0, parent.keys.get(index - 1));
		node.values.add(0, parent.values.get(index - 1));

		int last = lnode.nodeSize() - 1;
		parent.keys.set(index - 1, lnode.keys.remove(last));
		parent.values.set(index - 1, lnode.values.remove(last));

		if (!node.isLeaf) {
			Node moved = lnode.children.remove(lnode.children.size() - 1);
			moved.parent = node;
			node.children.add(0, moved);
		}

		verifyNode(lnode);
		verifyNode(node);
		verifyNode(parent);
	}

	/**
	** Performs a rotate operation towards the smaller node; the mirror image
	** of {@link #borrowFromLeft(Node, int)}.
	**
	** @param parent The parent of the node
	** @param index Position of the node, which accepts an entry
	*/
	private void borrowFromRight(Node parent, int index) {
		verify(index >= 0 && index < parent.children.size() - 1, parent, "borrowFromRight: bad index " + index);
		Node node = parent.children.get(index);
		Node rnode = parent.children.get(index + 1);
		if (logger.isLoggable(Level.FINER)) { logger.finer("borrowFromRight: " + rnode + " -> " + node); }

		node.keys.add(parent.keys.get(index));
		node.values.add(parent.values.get(index));

		parent.keys.set(index, rnode.keys.remove(0));
		parent.values.set(index, rnode.values.remove(0));

		if (!node.isLeaf) {
			Node moved = rnode.children.remove(0);
			moved.parent = node;
			node.children.add(moved);
		}

		verifyNode(rnode);
		verifyNode(node);
		verifyNode(parent);
	}

	/**
	** Merge two adjacent subnodes into one, using the entry that separates
	** them in the parent as the entry that joins them in the merged node.
	** Everything from the R subnode moves into the L subnode, and the R
	** subnode is discarded.
	**
	** If the parent is the root, it may be left empty; the caller is
	** responsible for collapsing it.
	**
	** @param parent The parent of both subnodes
	** @param index Position of the L subnode
	** @return The merged node
	*/
	protected Node mergeChildren(Node parent, int index) {
		verify(index >= 0 && index < parent.nodeSize(), parent, "mergeChildren: bad index " + index);
		Node lnode = parent.children.get(index);
		Node rnode = parent.children.get(index + 1);
		verify(lnode.isLeaf == rnode.isLeaf, parent, "mergeChildren: subnodes at different levels");
		verify(lnode.nodeSize() + rnode.nodeSize() < ENT_MAX, parent, "mergeChildren: merged node would overflow");
		if (logger.isLoggable(Level.FINER)) { logger.finer("mergeChildren: " + lnode + " + " + rnode + " in " + parent); }

		lnode.keys.add(parent.keys.remove(index));
		lnode.values.add(parent.values.remove(index));
		lnode.keys.addAll(rnode.keys);
		lnode.values.addAll(rnode.values);
		if (!lnode.isLeaf) {
			for (Node n: rnode.children) {
				n.parent = lnode;
				lnode.children.add(n);
			}
		}
		parent.children.remove(index + 1);
		rnode.parent = null;

		verifyNode(lnode);
		if (parent != root || parent.nodeSize() > 0) {
			verifyNode(parent);
		}
		return lnode;
	}

	/**
	** Replaces an empty root by its only subnode, or empties the tree if the
	** root is an empty leaf. Does nothing otherwise.
	*/
	private void collapseRoot() {
		if (root == null || root.nodeSize() > 0) { return; }
		if (root.isLeaf) {
			root = null;
			height = 0;
			if (logger.isLoggable(Level.FINE)) { logger.fine("collapseRoot: tree is now empty"); }
			return;
		}
		verify(root.children.size() == 1, root, "collapseRoot: empty root has " + root.children.size() + " subnodes");
		Node child = root.children.get(0);
		root.children.clear();
		child.parent = null;
		root = child;
		--height;
		if (logger.isLoggable(Level.FINE)) { logger.fine("collapseRoot: new root " + root + ", height " + height); }
	}

	/**
	** Sets the {@link Node#parent} of every node from scratch, in one pass
	** from the root. Used after the nodes were built by something other than
	** the insertion and deletion algorithms, eg. {@link NodeTranslator}.
	*/
	protected void rebuildParentPointers() {
		if (root == null) { return; }
		root.parent = null;
		rebuildParents(root);
	}

	private void rebuildParents(Node node) {
		for (Node ch: node.children) {
			ch.parent = node;
			rebuildParents(ch);
		}
	}

	/*========================================================================
	  printing
	 ========================================================================*/

	/**
	** Returns the tree structure, one line per node, level by level from the
	** root.
	*/
	public String toTreeString() {
		lock.readLock().lock();
		try {
			return treeString();
		} finally {
			lock.readLock().unlock();
		}
	}

	private String treeString() {
		StringBuilder s = new StringBuilder();
		s.append("Tree (degree=").append(DEGREE).append(", size=").append(size)
		 .append(", height=").append(height).append("):\n");
		if (root == null) {
			return s.append("(empty)\n").toString();
		}

		Queue<Node> queue = new LinkedList<Node>();
		queue.add(root);
		for (int level = 0; !queue.isEmpty(); ++level) {
			for (int i = queue.size(); i > 0; --i) {
				Node node = queue.remove();
				s.append("Level ").append(level).append(": ").append(node.keys).append('\n');
				queue.addAll(node.children);
			}
		}
		return s.toString();
	}

	@Override public String toString() {
		return "BTree(degree=" + DEGREE + ")";
	}

	/*========================================================================
	  snapshots
	 ========================================================================*/

	/**
	** Returns the whole tree as nested maps and lists; see {@link
	** NodeTranslator} for the layout of each node.
	*/
	public Map<String, Object> snapshot() {
		lock.readLock().lock();
		try {
			return snapshotMap();
		} finally {
			lock.readLock().unlock();
		}
	}

	/**
	** Writes the {@link #snapshot()} of this tree to the given stream. The
	** read lock is held until the writer returns, so that no mutation can
	** interleave with the encoding.
	*/
	public void writeSnapshot(ObjectStreamWriter<? super Map<String, Object>> writer, OutputStream os) throws IOException {
		lock.readLock().lock();
		try {
			writer.writeObject(snapshotMap(), os);
		} finally {
			lock.readLock().unlock();
		}
	}

	private Map<String, Object> snapshotMap() {
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		map.put("root", (root == null)? null: new NodeTranslator().app(root));
		map.put("degree", DEGREE);
		map.put("size", size);
		map.put("height", height);
		return map;
	}

	/**
	** Rebuilds a tree from a {@link #snapshot()}. The comparator is not part
	** of a snapshot and must be supplied again. Parent links are rebuilt, and
	** the result is validated before it is returned.
	**
	** @param map The snapshot
	** @param cmp The comparator for the tree, or {@code null} for natural
	**            ordering
	** @throws DataFormatException if the data does not describe a valid tree
	**         under the given comparator
	*/
	@SuppressWarnings("unchecked")
	public static <K, V> BTree<K, V> fromSnapshot(Map<String, Object> map, Comparator<? super K> cmp) throws DataFormatException {
		BTree<K, V> tree;
		try {
			tree = new BTree<K, V>(cmp, (Integer)map.get("degree"));
			Object r = map.get("root");
			if (r != null) {
				tree.root = tree.new NodeTranslator().rev((Map<String, Object>)r);
			}
			tree.size = (Integer)map.get("size");
			tree.height = (Integer)map.get("height");
		} catch (ClassCastException e) {
			throw new DataFormatException("Could not build BTree from data", e);
		} catch (NullPointerException e) {
			throw new DataFormatException("Could not build BTree from data", e);
		} catch (IllegalArgumentException e) {
			throw new DataFormatException("Could not build BTree from data", e);
		}

		tree.rebuildParentPointers();
		List<String> problems;
		try {
			problems = tree.inspect();
		} catch (ClassCastException e) {
			throw new DataFormatException("Snapshot keys cannot be compared", e);
		}
		if (!problems.isEmpty()) {
			throw new DataFormatException("Snapshot does not describe a valid B-tree: " + problems, null);
		}
		return tree;
	}

	/************************************************************************
	** Translates between a {@link Node} and a map of its fields. The map holds
	** {@code keys}, {@code children} (translated recursively), {@code isLeaf},
	** {@code size}, {@code maxKeys}, {@code minKeys} and {@code values}.
	**
	** {@link Node#parent} is not translated; {@link #rev(Map)} leaves it
	** unset on every node, and it is up to the caller to {@link
	** BTree#rebuildParentPointers() rebuild} it.
	*/
	protected class NodeTranslator implements Translator<Node, Map<String, Object>> {

		/*@Override**/ public Map<String, Object> app(Node node) {
			List<Map<String, Object>> subnodes = new ArrayList<Map<String, Object>>(node.children.size());
			for (Node ch: node.children) {
				subnodes.add(app(ch));
			}
			Map<String, Object> map = new LinkedHashMap<String, Object>();
			map.put("keys", new ArrayList<K>(node.keys));
			map.put("children", subnodes);
			map.put("isLeaf", node.isLeaf);
			map.put("size", node.nodeSize());
			map.put("maxKeys", ENT_MAX);
			map.put("minKeys", ENT_MIN);
			map.put("values", new ArrayList<V>(node.values));
			return map;
		}

		@SuppressWarnings("unchecked")
		/*@Override**/ public Node rev(Map<String, Object> map) throws DataFormatException {
			try {
				List<K> keys = (List<K>)map.get("keys");
				List<V> values = (List<V>)map.get("values");
				List<Object> subnodes = (List<Object>)map.get("children");
				boolean leaf = (Boolean)map.get("isLeaf");
				int sz = (Integer)map.get("size");

				if (keys.contains(null)) {
					throw new DataFormatException("Node has a null key", null);
				}
				if (keys.size() != sz || values.size() != sz) {
					throw new DataFormatException("Node size " + sz + " does not match its " + keys.size() + " keys and " + values.size() + " values", null);
				}
				if ((Integer)map.get("maxKeys") != ENT_MAX || (Integer)map.get("minKeys") != ENT_MIN) {
					throw new DataFormatException("Node bounds do not match degree " + DEGREE, null);
				}
				if (leaf != (subnodes == null || subnodes.isEmpty())) {
					throw new DataFormatException("Node leaf flag does not match its subnodes", null);
				}

				Node node = newNode(leaf);
				node.keys.addAll(keys);
				node.values.addAll(values);
				if (!leaf) {
					for (Object o: subnodes) {
						node.children.add(rev((Map<String, Object>)o));
					}
				}
				return node;
			} catch (ClassCastException e) {
				throw new DataFormatException("Could not build node from data", e);
			} catch (NullPointerException e) {
				throw new DataFormatException("Could not build node from data", e);
			}
		}

	}

}
