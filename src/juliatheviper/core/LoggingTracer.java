// This file is part of the Julia the Viper Interpreter (jtv).
//
// The Julia the Viper Interpreter is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Julia the Viper Interpreter is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Julia the Viper Interpreter. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.

package juliatheviper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import juliatheviper.core.Syntax.Control;
import juliatheviper.core.Syntax.FunctionDef;
import juliatheviper.core.Syntax.ReverseBlock;

/**
 * Forwards interpreter events to the <code>juliatheviper.trace</code> logger.
 *
 * @author David J. Pearce
 *
 */
public class LoggingTracer implements Tracer {
	private static final Logger log = LoggerFactory.getLogger("juliatheviper.trace");

	@Override
	public void statement(Control stmt, Environment frame) {
		if (log.isTraceEnabled()) {
			log.trace("line {}: {} {}", stmt.line(), stmt, frame);
		}
	}

	@Override
	public void enter(FunctionDef function, Environment frame) {
		log.debug("enter {} with {}", function.name(), frame);
	}

	@Override
	public void exit(FunctionDef function, NumericValue result) {
		log.debug("exit {} returning {}", function.name(), result);
	}

	@Override
	public void reverse(ReverseBlock block, boolean forward) {
		log.debug("{} reverse block #{} (line {})", forward ? "apply" : "rollback", block.index(), block.line());
	}
}
