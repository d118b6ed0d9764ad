/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io;

import java.io.InputStream;
import java.io.IOException;

/**
** Reads one object back from a stream; the counterpart of {@link
** ObjectStreamWriter}.
**
** @author infinity0
*/
public interface ObjectStreamReader<T> {

	/**
	** Read and return the object from the given stream.
	**
	** @throws DataFormatException if the stream does not hold a valid object
	*/
	public T readObject(InputStream is) throws IOException;

}
