/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io.serial;

import plugins.ElasticBTree.io.serial.Serialiser.*;
import plugins.ElasticBTree.io.DataFormatException;
import plugins.ElasticBTree.io.ObjectStreamReader;
import plugins.ElasticBTree.io.ObjectStreamWriter;
import plugins.ElasticBTree.util.exec.TaskAbortException;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
** Converts between an object and a file on disk. An {@link
** ObjectStreamReader} and an {@link ObjectStreamWriter} are used to do the
** hard work once the relevant streams have been established.
**
** This class expects {@link Task#meta} to be a {@link File} or a {@link
** String} path.
**
** Failures are reported as follows:
**
** * a missing file on pull: {@link ArchiveNotFoundException}
** * content that the reader rejects: {@link TaskAbortException} caused by
**   the {@link DataFormatException}, not to be retried
** * any other I/O failure: {@link TaskAbortException}, may be retried
**
** @author infinity0
*/
public class FileArchiver<T> implements Archiver<T> {

	private static final Logger logger = Logger.getLogger(FileArchiver.class.getName());

	final protected ObjectStreamReader<? extends T> reader;
	final protected ObjectStreamWriter<? super T> writer;

	public <S extends ObjectStreamReader<T> & ObjectStreamWriter<T>> FileArchiver(S rw) {
		this(rw, rw);
	}

	public FileArchiver(ObjectStreamReader<? extends T> r, ObjectStreamWriter<? super T> w) {
		reader = r;
		writer = w;
	}

	protected File getFile(Object meta) {
		if (meta instanceof File) { return (File)meta; }
		if (meta instanceof String) { return new File((String)meta); }
		throw new IllegalArgumentException("FileArchiver does not support such metadata: " + meta);
	}

	/*@Override**/ public void pull(PullTask<T> t) throws TaskAbortException {
		File file = getFile(t.meta);
		if (!file.exists()) {
			throw new ArchiveNotFoundException("No archive at " + file, t.meta);
		}
		try {
			FileInputStream is = new FileInputStream(file);
			try {
				FileLock lock = is.getChannel().lock(0L, Long.MAX_VALUE, true); // shared lock for reading
				try {
					t.data = reader.readObject(is);
				} finally {
					lock.release();
				}
			} finally {
				is.close();
			}
		} catch (DataFormatException e) {
			throw new TaskAbortException("FileArchiver could not parse " + file, e, false);
		} catch (IOException e) {
			throw new TaskAbortException("FileArchiver could not complete pull on " + file, e, true);
		} catch (RuntimeException e) {
			throw new TaskAbortException("FileArchiver could not complete pull on " + file, e);
		}
		if (logger.isLoggable(Level.FINE)) { logger.fine("Pulled " + file); }
	}

	/**
	** Writes the data to a temporary file next to the target, then renames it
	** over the target. If the write fails, any earlier archive is left as it
	** was.
	*/
	/*@Override**/ public void push(PushTask<T> t) throws TaskAbortException {
		File file = getFile(t.meta);
		File tmp = new File(file.getAbsoluteFile().getParentFile(), file.getName() + ".tmp");
		boolean done = false;
		try {
			File dir = tmp.getParentFile();
			if (!dir.isDirectory() && !dir.mkdirs()) {
				throw new IOException("Could not create directory " + dir);
			}
			FileOutputStream os = new FileOutputStream(tmp);
			try {
				FileLock lock = os.getChannel().lock();
				try {
					writer.writeObject(t.data, os);
				} finally {
					lock.release();
				}
			} finally {
				os.close();
			}
			Files.move(tmp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			done = true;
		} catch (DataFormatException e) {
			throw new TaskAbortException("FileArchiver could not encode data for " + file, e, false);
		} catch (IOException e) {
			throw new TaskAbortException("FileArchiver could not complete push on " + file, e, true);
		} catch (RuntimeException e) {
			throw new TaskAbortException("FileArchiver could not complete push on " + file, e);
		} finally {
			if (!done && tmp.exists() && !tmp.delete()) {
				logger.warning("Could not remove partial archive " + tmp);
			}
		}
		if (logger.isLoggable(Level.FINE)) { logger.fine("Pushed " + file); }
	}

	/**
	** Removes the archive named by the given metadata. Does nothing if there
	** is no such archive.
	*/
	public void delete(Object meta) throws TaskAbortException {
		File file = getFile(meta);
		try {
			if (Files.deleteIfExists(file.toPath()) && logger.isLoggable(Level.FINE)) {
				logger.fine("Deleted " + file);
			}
		} catch (IOException e) {
			throw new TaskAbortException("FileArchiver could not delete " + file, e, true);
		}
	}

}
