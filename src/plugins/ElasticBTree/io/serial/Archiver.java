/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io.serial;

import plugins.ElasticBTree.io.serial.Serialiser.*;
import plugins.ElasticBTree.util.exec.TaskAbortException;

/**
** An interface that handles a single {@link Serialiser.Task}.
**
** @author infinity0
*/
public interface Archiver<T> extends Serialiser<T> {

	/**
	** Execute a {@link PullTask}, returning only when the task is done. On
	** success, {@link Task#data} holds the retrieved object.
	**
	** @param task The task to execute
	** @throws TaskAbortException if the data could not be retrieved
	*/
	public void pull(PullTask<T> task) throws TaskAbortException;

	/**
	** Execute a {@link PushTask}, returning only when the task is done.
	**
	** @param task The task to execute
	** @throws TaskAbortException if the data could not be archived
	*/
	public void push(PushTask<T> task) throws TaskAbortException;

}
