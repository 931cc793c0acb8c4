/**
 * The parsing and rendering machinery behind {@link org.stianloader.picoversion.Version}:
 * classification of literals, extraction of components and the three textual forms of a version.
 *
 * <p>This package is not API. Its classes may change without notice between releases.
 */
package org.stianloader.picoversion.internal;
