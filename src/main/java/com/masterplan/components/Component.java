package com.masterplan.components;

/**
 * These are the top-level modules of the release server that are instantiated and wired up to one another when the
 * application starts up. There is typically only one instance of each component, and all references to the component
 * are final.
 *
 * This is a marker interface with no methods. All Components should be threadsafe: they must not fail when
 * concurrently used by multiple HTTP handler threads and background jobs.
 */
public interface Component {

}
