package ca.nrc.ami3.domain.asn;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class MemberRoleTest {

  @Test
  void tagsAreCaseInsensitive() {
    assertEquals(MemberRole.SCIENCE, MemberRole.fromTag("science"));
    assertEquals(MemberRole.SCIENCE, MemberRole.fromTag(" SCIENCE "));
    assertEquals(MemberRole.REFERENCE, MemberRole.fromTag("reference"));
  }

  @Test
  void psfIsAReferenceAlias() {
    assertEquals(MemberRole.REFERENCE, MemberRole.fromTag("psf"));
    assertEquals(MemberRole.REFERENCE, MemberRole.fromTag("PSF"));
  }

  @Test
  void unknownOrMissingTagsMapToOther() {
    assertEquals(MemberRole.OTHER, MemberRole.fromTag("background"));
    assertEquals(MemberRole.OTHER, MemberRole.fromTag(""));
    assertEquals(MemberRole.OTHER, MemberRole.fromTag(null));
  }

  @Test
  void onlyOtherIsNotAggregated() {
    assertTrue(MemberRole.SCIENCE.aggregated());
    assertTrue(MemberRole.REFERENCE.aggregated());
    assertFalse(MemberRole.OTHER.aggregated());
  }
}
