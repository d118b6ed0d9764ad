/* This code is part of Freenet. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package plugins.ElasticBTree.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
** Outcome of {@link BTree#validateTree()}.
**
** @author infinity0
*/
public class ValidationReport {

	final protected List<String> problems;

	public ValidationReport(List<String> p) {
		problems = Collections.unmodifiableList(new ArrayList<String>(p));
	}

	public boolean isValid() {
		return problems.isEmpty();
	}

	/**
	** @return Description of each broken constraint, in the order found; empty
	**         if the tree is valid
	*/
	public List<String> getProblems() {
		return problems;
	}

	@Override public String toString() {
		return (problems.isEmpty())? "valid": "invalid: " + problems;
	}

}
