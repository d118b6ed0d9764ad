/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.util;

/**
** Thrown when a {@link BTree} finds its own structure broken. This always
** indicates a bug in the tree code, never bad input, so it is an {@link
** Error}; callers are not expected to recover from it.
**
** @author infinity0
*/
public class IntegrityError extends AssertionError {

	private static final long serialVersionUID = 1L;

	public IntegrityError(String s) {
		super(s);
	}

}
