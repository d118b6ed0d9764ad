/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io.serial;

import plugins.ElasticBTree.io.DataFormatException;

/**
** A class that translates an object into one of another type. Used mostly in
** conjunction with an {@link Archiver} that can take objects of the latter
** type but not the former type.
**
** @author infinity0
*/
public interface Translator<T, I> {

	/**
	** Apply the translation.
	**
	** @throws DataFormatException if some aspect of the input prevents the
	**         output from being constructed.
	*/
	I app(T translatee) throws DataFormatException;

	/**
	** Reverse the translation.
	**
	** @throws DataFormatException if some aspect of the input prevents the
	**         output from being constructed.
	*/
	T rev(I intermediate) throws DataFormatException;

}
