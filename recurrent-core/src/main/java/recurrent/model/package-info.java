/**
 * Value types shared by the scheduling components.
 */
package recurrent.model;
