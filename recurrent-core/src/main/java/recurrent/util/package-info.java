/**
 * Small internal utilities: thread naming and flat JSON encoding.
 */
package recurrent.util;
