package org.qarg.shape;

import org.junit.Assert;
import org.junit.Test;

/** Tests the derivation of command-line names from field names */
public class NamesTest {
	/** Tests long option names derived from camel-case field names */
	@Test
	public void testLongNames() {
		Assert.assertEquals("verbose", Names.toLongName("verbose"));
		Assert.assertEquals("set-upstream", Names.toLongName("setUpstream"));
		Assert.assertEquals("ids", Names.toLongName("IDs"));
		Assert.assertEquals("user-ids", Names.toLongName("userIDs"));
		Assert.assertEquals("http-port", Names.toLongName("HTTPPort"));
		Assert.assertEquals("dry-run", Names.toLongName("dry_run"));
		Assert.assertEquals("level2-cache", Names.toLongName("level2Cache"));
		Assert.assertEquals("already-hyphenated", Names.toLongName("already-hyphenated"));
	}

	/** Tests placeholder and environment names derived from long names */
	@Test
	public void testConstantNames() {
		Assert.assertEquals("DATASET", Names.toConstantName("dataset"));
		Assert.assertEquals("SET_UPSTREAM", Names.toConstantName("set-upstream"));
	}
}
