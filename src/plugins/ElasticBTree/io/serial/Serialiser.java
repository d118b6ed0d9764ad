/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io.serial;

/**
** An empty marker interface for serialisation classes. It defines the nested
** task classes that are passed between them.
**
** @author infinity0
*/
public interface Serialiser<T> {

	/**
	** Defines a serialisation task for an object. Contains two fields: data
	** and metadata. The metadata says where the data lives, eg. a {@link
	** java.io.File}.
	*/
	abstract public static class Task<T> {

		public Object meta = null;

		public T data = null;

	}

	/**
	** Defines a pull task: given some metadata, the task is to retrieve the
	** data for this metadata.
	*/
	final public static class PullTask<T> extends Task<T> {

		public PullTask(Object m) {
			if (m == null) {
				throw new IllegalArgumentException("Cowardly refusing to make a PullTask with null metadata.");
			}
			meta = m;
		}

	}

	/**
	** Defines a push task: given some data and metadata, the task is to
	** archive the data at the place the metadata names.
	*/
	final public static class PushTask<T> extends Task<T> {

		public PushTask(T d, Object m) {
			if (d == null) {
				throw new IllegalArgumentException("Cowardly refusing to make a PushTask with null data.");
			}
			data = d;
			meta = m;
		}

	}

}
