/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.util.exec;

import plugins.ElasticBTree.io.DataFormatException;

import java.io.IOException;

/**
** Thrown when a load or save of a tree snapshot does not complete.
**
** @author infinity0
** @see plugins.ElasticBTree.io.serial.Archiver
*/
public class TaskAbortException extends Exception {

	/**
	** Whether the abortion was due to an error condition. Defaults to {@code
	** true}. A {@code false} value means the task could not run but nothing
	** is wrong as such, eg. {@link
	** plugins.ElasticBTree.io.serial.ArchiveNotFoundException}.
	*/
	final protected boolean error;

	/**
	** Whether the failure is temporary, and the caller may try again later.
	** Eg. this is {@code true} for abortions caused by {@link IOException},
	** and {@code false} for abortions caused by {@link DataFormatException},
	** since reading the same bytes again will fail in the same way.
	*/
	final protected boolean retry;

	/**
	** @param s The detail message
	** @param t The cause
	** @param e Whether the current abortion is {@link #error}.
	** @param r Whether a {@link #retry} is likely to succeed.
	*/
	public TaskAbortException(String s, Throwable t, boolean e, boolean r) {
		super(s, t);
		error = e;
		retry = r;
	}

	/**
	** Constructs a new exception marked as error.
	*/
	public TaskAbortException(String s, Throwable t, boolean r) {
		this(s, t, true, r);
	}

	/**
	** Constructs a new exception marked as error and non-retry.
	*/
	public TaskAbortException(String s, Throwable t) {
		this(s, t, true, false);
	}

	/**
	** @see #error
	*/
	public boolean isError() {
		return error;
	}

	/**
	** @see #retry
	*/
	public boolean isRetry() {
		return retry;
	}

}
