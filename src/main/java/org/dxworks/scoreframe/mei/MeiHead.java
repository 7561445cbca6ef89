package org.dxworks.scoreframe.mei;

public class MeiHead {
    public String title;
    public String composer;
}
