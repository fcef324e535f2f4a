package io.github.yok.flexconfigure.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

class ArtifactTypeTest {

    @Test
    void fromSourceName_正常ケース_大文字小文字違いを指定する_種別が解決されること() {
        assertEquals(ArtifactType.INTEGRATION, ArtifactType.fromSourceName("integration"));
        assertEquals(ArtifactType.MESSAGE_MAPPING, ArtifactType.fromSourceName("MessageMapping"));
        assertEquals(ArtifactType.SCRIPT_COLLECTION,
                ArtifactType.fromSourceName(" SCRIPTCOLLECTION "));
        assertEquals(ArtifactType.VALUE_MAPPING, ArtifactType.fromSourceName("valuemapping"));
    }

    @Test
    void fromSourceName_正常ケース_未指定を指定する_Integrationとなること() {
        assertEquals(ArtifactType.INTEGRATION, ArtifactType.fromSourceName(null));
        assertEquals(ArtifactType.INTEGRATION, ArtifactType.fromSourceName(""));
    }

    @Test
    void fromSourceName_異常ケース_不明な名前を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> ArtifactType.fromSourceName("Flow"));
    }

    @Test
    void toString_正常ケース_種別を指定する_宣言名が返ること() {
        assertEquals("ScriptCollection", ArtifactType.SCRIPT_COLLECTION.toString());
    }
}
