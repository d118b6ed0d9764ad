/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.io;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;

/**
** Converts between an object and a stream containing a YAML document. Only
** plain data is supported: maps, lists, strings, numbers, booleans and
** {@code null}. No application classes are ever constructed on reading.
**
** @see Yaml
** @author infinity0
*/
public class YamlReaderWriter
implements ObjectStreamReader<Object>, ObjectStreamWriter<Object> {


	public YamlReaderWriter() {
	}

	/*@Override**/ public Object readObject(InputStream is) throws IOException {
		try {
			return makeYAML().load(new InputStreamReader(is, "UTF-8"));
		} catch (YAMLException e) {
			throw new DataFormatException("Yaml could not process the stream: " + is, e);
		}
	}

	/*@Override**/ public void writeObject(Object o, OutputStream os) throws IOException {
		try {
			Writer w = new OutputStreamWriter(os, "UTF-8");
			makeYAML().dump(o, w);
			w.flush();
		} catch (YAMLException e) {
			throw new DataFormatException("Yaml could not process the object", e);
		}
	}

	/** A Yaml instance holds on to the last document it composed, so we make a
	 * fresh one for each call rather than sharing it between threads. */
	private Yaml makeYAML() {
		DumperOptions opt = new DumperOptions();
		opt.setWidth(Integer.MAX_VALUE);
		opt.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
		LoaderOptions lopt = new LoaderOptions();
		lopt.setAllowDuplicateKeys(false);
		// a snapshot holds the whole tree in one document
		lopt.setCodePointLimit(Integer.MAX_VALUE);
		return new Yaml(new SafeConstructor(lopt), new Representer(opt), opt, lopt);
	}

}
