package com.example.workbookreport.report;

import com.example.workbookreport.model.CellRole;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StylePolicyTest {

    private final StylePolicy policy = new StylePolicy();

    @Test
    public void testEveryRoleHasABorder() {
        for (CellRole role : CellRole.values()) {
            assertTrue(policy.formatFor(role).thinBorder(), role.name());
        }
    }

    @Test
    public void testOnlyHeaderCellsAreFilled() {
        assertEquals(StylePolicy.HEADER_FILL_COLOR, policy.formatFor(CellRole.HEADER).fillColor());
        assertNull(policy.formatFor(CellRole.BODY).fillColor());
        assertNull(policy.formatFor(CellRole.TITLE).fillColor());
        assertNull(policy.formatFor(CellRole.SECTION).fillColor());
    }

    @Test
    public void testTitleUsesLargeBoldFont() {
        assertTrue(policy.formatFor(CellRole.TITLE).bold());
        assertEquals(16, policy.formatFor(CellRole.TITLE).fontSize());
    }
}
