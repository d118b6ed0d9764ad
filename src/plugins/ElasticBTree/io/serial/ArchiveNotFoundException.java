/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io.serial;

import plugins.ElasticBTree.util.exec.TaskAbortException;

/**
** Thrown when a pull names an archive that does not exist. This is not an
** {@link TaskAbortException#isError() error}: callers can treat it as
** "nothing saved yet".
**
** @author infinity0
*/
public class ArchiveNotFoundException extends TaskAbortException {

	final protected Object meta;

	public ArchiveNotFoundException(String s, Object m) {
		super(s, null, false, false);
		meta = m;
	}

	public Object getMeta() {
		return meta;
	}

}
