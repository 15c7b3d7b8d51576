/**
 * Time-based views of a reading collection: trailing moving averages and
 * calendar-month aggregates with month-over-month growth.
 */
package com.millsentinel.core.trend;
