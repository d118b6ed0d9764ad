/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io;

import java.io.OutputStream;
import java.io.IOException;

/**
** Writes one object to a stream, in a form that the matching {@link
** ObjectStreamReader} can read back.
**
** @author infinity0
*/
public interface ObjectStreamWriter<T> {

	/**
	** Write the given object to the given stream. The stream is flushed but
	** not closed.
	*/
	public void writeObject(T o, OutputStream os) throws IOException;

}
