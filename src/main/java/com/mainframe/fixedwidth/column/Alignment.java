package com.mainframe.fixedwidth.column;

/**
 * Side of the column the value is flush against. Padding fills the opposite side.
 */
public enum Alignment {
    LEFT,
    RIGHT
}
