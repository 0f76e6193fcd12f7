package fleet.task;

import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ActionKindTest {

    @Test(description = "Wire names are lower case")
    public void testWireName() {
        assertThat(ActionKind.NAVIGATE.wireName()).isEqualTo("navigate");
        assertThat(ActionKind.CUSTOM.wireName()).isEqualTo("custom");
    }

    @Test(description = "fromWire accepts any case and rejects unknown values")
    public void testFromWire() {
        assertThat(ActionKind.fromWire("scroll")).contains(ActionKind.SCROLL);
        assertThat(ActionKind.fromWire(" FILL ")).contains(ActionKind.FILL);
        assertThat(ActionKind.fromWire("hover")).isEmpty();
        assertThat(ActionKind.fromWire(null)).isEmpty();
    }
}
