/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io;

/**
** Thrown when data read back from a snapshot does not describe a tree, or
** cannot be parsed at all.
**
** @author infinity0
*/
public class DataFormatException extends java.io.IOException {

	public DataFormatException(String s, Throwable t) {
		super(s);
		initCause(t);
	}

}
