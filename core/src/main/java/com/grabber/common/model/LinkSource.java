package com.grabber.common.model;

import java.io.File;

/**
 * A bulk-mode source: a creator folder holding a links file. Media downloaded for the
 * links end up in the same folder.
 */
public record LinkSource(String name, File folder, File linksFile) {
}
