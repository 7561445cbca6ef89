package org.dxworks.scoreframe.mei;

/**
 * Content allowed inside a staffGrp.
 */
public interface StaffGrpChild {
}
