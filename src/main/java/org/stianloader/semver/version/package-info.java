/**
 * Semantic and NuGet-style versions, their ordering and the version ranges built on top of them.
 * Everything in this package is immutable and may be shared between threads freely.
 */
package org.stianloader.semver.version;
