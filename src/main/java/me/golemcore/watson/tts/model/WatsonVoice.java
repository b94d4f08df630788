package me.golemcore.watson.tts.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Voices offered by the Text to Speech service.
 */
public enum WatsonVoice {
    AR_MS_OMAR("ar-MS_OmarVoice"),
    CS_CZ_ALENA("cs-CZ_AlenaVoice"),
    DE_DE_BIRGIT_V3("de-DE_BirgitV3Voice"),
    DE_DE_DIETER_V3("de-DE_DieterV3Voice"),
    DE_DE_ERIKA_V3("de-DE_ErikaV3Voice"),
    EN_AU_CRAIG("en-AU_CraigVoice"),
    EN_AU_MADISON("en-AU_MadisonVoice"),
    EN_AU_STEVE("en-AU_SteveVoice"),
    EN_GB_CHARLOTTE_V3("en-GB_CharlotteV3Voice"),
    EN_GB_JAMES_V3("en-GB_JamesV3Voice"),
    EN_GB_KATE_V3("en-GB_KateV3Voice"),
    EN_US_ALLISON_V3("en-US_AllisonV3Voice"),
    EN_US_EMILY_V3("en-US_EmilyV3Voice"),
    EN_US_HENRY_V3("en-US_HenryV3Voice"),
    EN_US_KEVIN_V3("en-US_KevinV3Voice"),
    EN_US_LISA_V3("en-US_LisaV3Voice"),
    EN_US_MICHAEL_V3("en-US_MichaelV3Voice"),
    EN_US_OLIVIA_V3("en-US_OliviaV3Voice"),
    ES_ES_ENRIQUE_V3("es-ES_EnriqueV3Voice"),
    ES_ES_LAURA_V3("es-ES_LauraV3Voice"),
    ES_LA_SOFIA_V3("es-LA_SofiaV3Voice"),
    ES_US_SOFIA_V3("es-US_SofiaV3Voice"),
    FR_CA_LOUISE_V3("fr-CA_LouiseV3Voice"),
    FR_FR_NICOLAS_V3("fr-FR_NicolasV3Voice"),
    FR_FR_RENEE_V3("fr-FR_ReneeV3Voice"),
    IT_IT_FRANCESCA_V3("it-IT_FrancescaV3Voice"),
    JA_JP_EMI_V3("ja-JP_EmiV3Voice"),
    KO_KR_HYUNJUN("ko-KR_HyunjunVoice"),
    KO_KR_SI_WOO("ko-KR_SiWooVoice"),
    KO_KR_YOUNGMI("ko-KR_YoungmiVoice"),
    KO_KR_YUNA("ko-KR_YunaVoice"),
    NL_BE_ADELE("nl-BE_AdeleVoice"),
    NL_BE_BRAM("nl-BE_BramVoice"),
    NL_NL_EMMA("nl-NL_EmmaVoice"),
    NL_NL_LIAM("nl-NL_LiamVoice"),
    PT_BR_ISABELA_V3("pt-BR_IsabelaV3Voice"),
    SV_SE_INGRID("sv-SE_IngridVoice"),
    ZH_CN_LI_NA("zh-CN_LiNaVoice"),
    ZH_CN_WANG_WEI("zh-CN_WangWeiVoice"),
    ZH_CN_ZHANG_JING("zh-CN_ZhangJingVoice");

    public static final WatsonVoice DEFAULT = EN_US_MICHAEL_V3;

    private final String id;

    WatsonVoice(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Language the voice speaks, derived from the id prefix.
     */
    public Language getLanguage() {
        return Language.fromId(id.substring(0, id.indexOf('_')))
                .orElseThrow(() -> new IllegalStateException("No language for voice " + id));
    }

    public static Optional<WatsonVoice> fromId(String id) {
        return Arrays.stream(values())
                .filter(voice -> voice.id.equals(id))
                .findFirst();
    }
}
