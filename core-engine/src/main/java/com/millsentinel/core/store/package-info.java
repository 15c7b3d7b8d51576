/**
 * Reading snapshots handed to the analyses, and the cleaning applied to raw
 * readings before any of them runs.
 */
package com.millsentinel.core.store;
