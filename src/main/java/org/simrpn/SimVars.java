/*
 * Copyright 2017-18 White Label Dev Ltd, and contributors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *  http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.simrpn;

import static org.simrpn.SimRpn.logV;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The simulation variable store, values owned by a system outside the engine and addressed as (PREFIX:KEY)
 * <p>Prefix "A" also answers reads from the legacy scalars, entries older files kept directly under the store
 * instead of inside a prefix. Those are never written to by the engine, a write always lands in the prefix map.</p>
 *
 * @author WLD-PJ <wld-pj@kabap.org>
 * @version 1.0
 * @since 1.0
 */
public class SimVars {
	private static final String LOG_TAG = SimVars.class.getSimpleName ();

	/** The prefix which falls back to legacy scalars on read */
	public static final String LEGACY_PREFIX = "A";

	private final LinkedHashMap<String, LinkedHashMap<String, Double>> prefixes = new LinkedHashMap<String, LinkedHashMap<String, Double>> ();
	private final LinkedHashMap<String, Double> legacy = new LinkedHashMap<String, Double> ();
	private boolean dirty = false;

	/**
	 * Reads a simulation variable
	 *
	 * @param prefix Short prefix, such as A or L
	 * @param key Arbitrary key within the prefix
	 * @return The value, or 0 when not set
	 */
	public double simVarGet (String prefix, String key) {
		Map<String, Double> values = prefixes.get (prefix);
		if (values != null && values.containsKey (key))
			return values.get (key);

		if (prefix.equals (LEGACY_PREFIX) && legacy.containsKey (key))
			return legacy.get (key);

		return 0;
	}

	/**
	 * Writes a simulation variable and marks the store dirty
	 *
	 * @param prefix Short prefix, such as A or L
	 * @param key Arbitrary key within the prefix
	 * @param value Value to store
	 */
	public void simVarSet (String prefix, String key, double value) {
		if (SimRpn.DEBUG)
			logV (LOG_TAG, "Setting simvar: (" + prefix + ":" + key + ")=" + value);

		LinkedHashMap<String, Double> values = prefixes.get (prefix);
		if (values == null) {
			values = new LinkedHashMap<String, Double> ();
			prefixes.put (prefix, values);
		}

		values.put (key, value);
		dirty = true;
	}

	/**
	 * Stores a legacy scalar as found in older files, does not mark the store dirty
	 *
	 * @param key Key as found directly under the store
	 * @param value Value to store
	 */
	public void legacySet (String key, double value) {
		legacy.put (key, value);
	}

	/**
	 * Merges another store over this one, prefix by prefix, used for inline overrides
	 *
	 * @param overrides The values to lay over this store
	 */
	public void merge (SimVars overrides) {
		for (Map.Entry<String, LinkedHashMap<String, Double>> entry : overrides.prefixes.entrySet ()) {
			LinkedHashMap<String, Double> values = prefixes.get (entry.getKey ());
			if (values == null) {
				values = new LinkedHashMap<String, Double> ();
				prefixes.put (entry.getKey (), values);
			}

			values.putAll (entry.getValue ());
		}

		legacy.putAll (overrides.legacy);
	}

	/**
	 * Retrieves the prefix maps, keyed by prefix
	 */
	public Map<String, LinkedHashMap<String, Double>> prefixesGet () {
		return prefixes;
	}

	/**
	 * Retrieves the legacy scalars
	 */
	public Map<String, Double> legacyGet () {
		return legacy;
	}

	/**
	 * Whether any write has happened since creation or the last {@link #dirtyClear()}
	 */
	public boolean isDirty () {
		return dirty;
	}

	/**
	 * Forgets earlier writes, typically after the store has been saved
	 */
	public void dirtyClear () {
		dirty = false;
	}

	/**
	 * Deep copy, including the dirty flag
	 *
	 * @return An independent store holding the same values
	 */
	public SimVars copy () {
		SimVars simVars = new SimVars ();
		for (Map.Entry<String, LinkedHashMap<String, Double>> entry : prefixes.entrySet ())
			simVars.prefixes.put (entry.getKey (), new LinkedHashMap<String, Double> (entry.getValue ()));

		simVars.legacy.putAll (legacy);
		simVars.dirty = dirty;
		return simVars;
	}
}
