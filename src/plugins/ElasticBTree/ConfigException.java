/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree;

/**
** Thrown when a configuration setting has an unusable value.
**
** @author infinity0
*/
public class ConfigException extends Exception {

	/**
	** Name of the offending setting.
	*/
	final protected String setting;

	public ConfigException(String name, String s) {
		super(s);
		setting = name;
	}

	public ConfigException(String name, String s, Throwable t) {
		super(s, t);
		setting = name;
	}

	public String getSetting() {
		return setting;
	}

}
