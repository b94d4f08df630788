package me.golemcore.watson.stt.model;

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
 * Base language models of the Speech to Text service.
 *
 * <p>
 * Previous-generation models are named {@code *_BroadbandModel} (16 kHz and
 * up) and {@code *_NarrowbandModel} (8 kHz). Next-generation models are named
 * {@code *_Multimedia} and {@code *_Telephony}.
 */
public enum SpeechModelId {
    AR_MS_BROADBAND("ar-MS_BroadbandModel"),
    DE_DE_BROADBAND("de-DE_BroadbandModel"),
    DE_DE_NARROWBAND("de-DE_NarrowbandModel"),
    EN_AU_BROADBAND("en-AU_BroadbandModel"),
    EN_AU_NARROWBAND("en-AU_NarrowbandModel"),
    EN_GB_BROADBAND("en-GB_BroadbandModel"),
    EN_GB_NARROWBAND("en-GB_NarrowbandModel"),
    EN_US_BROADBAND("en-US_BroadbandModel"),
    EN_US_NARROWBAND("en-US_NarrowbandModel"),
    EN_US_SHORT_FORM_NARROWBAND("en-US_ShortForm_NarrowbandModel"),
    ES_AR_BROADBAND("es-AR_BroadbandModel"),
    ES_AR_NARROWBAND("es-AR_NarrowbandModel"),
    ES_CL_BROADBAND("es-CL_BroadbandModel"),
    ES_CL_NARROWBAND("es-CL_NarrowbandModel"),
    ES_CO_BROADBAND("es-CO_BroadbandModel"),
    ES_CO_NARROWBAND("es-CO_NarrowbandModel"),
    ES_ES_BROADBAND("es-ES_BroadbandModel"),
    ES_ES_NARROWBAND("es-ES_NarrowbandModel"),
    ES_MX_BROADBAND("es-MX_BroadbandModel"),
    ES_MX_NARROWBAND("es-MX_NarrowbandModel"),
    ES_PE_BROADBAND("es-PE_BroadbandModel"),
    ES_PE_NARROWBAND("es-PE_NarrowbandModel"),
    FR_CA_BROADBAND("fr-CA_BroadbandModel"),
    FR_CA_NARROWBAND("fr-CA_NarrowbandModel"),
    FR_FR_BROADBAND("fr-FR_BroadbandModel"),
    FR_FR_NARROWBAND("fr-FR_NarrowbandModel"),
    IT_IT_BROADBAND("it-IT_BroadbandModel"),
    IT_IT_NARROWBAND("it-IT_NarrowbandModel"),
    JA_JP_BROADBAND("ja-JP_BroadbandModel"),
    JA_JP_NARROWBAND("ja-JP_NarrowbandModel"),
    KO_KR_BROADBAND("ko-KR_BroadbandModel"),
    KO_KR_NARROWBAND("ko-KR_NarrowbandModel"),
    NL_NL_BROADBAND("nl-NL_BroadbandModel"),
    NL_NL_NARROWBAND("nl-NL_NarrowbandModel"),
    PT_BR_BROADBAND("pt-BR_BroadbandModel"),
    PT_BR_NARROWBAND("pt-BR_NarrowbandModel"),
    ZH_CN_BROADBAND("zh-CN_BroadbandModel"),
    ZH_CN_NARROWBAND("zh-CN_NarrowbandModel"),
    AR_MS_TELEPHONY("ar-MS_Telephony"),
    CS_CZ_TELEPHONY("cs-CZ_Telephony"),
    DE_DE_MULTIMEDIA("de-DE_Multimedia"),
    DE_DE_TELEPHONY("de-DE_Telephony"),
    EN_AU_MULTIMEDIA("en-AU_Multimedia"),
    EN_AU_TELEPHONY("en-AU_Telephony"),
    EN_GB_MULTIMEDIA("en-GB_Multimedia"),
    EN_GB_TELEPHONY("en-GB_Telephony"),
    EN_IN_TELEPHONY("en-IN_Telephony"),
    EN_US_MULTIMEDIA("en-US_Multimedia"),
    EN_US_TELEPHONY("en-US_Telephony"),
    EN_WW_MEDICAL_TELEPHONY("en-WW_Medical_Telephony"),
    ES_ES_MULTIMEDIA("es-ES_Multimedia"),
    ES_ES_TELEPHONY("es-ES_Telephony"),
    ES_LA_TELEPHONY("es-LA_Telephony"),
    FR_CA_MULTIMEDIA("fr-CA_Multimedia"),
    FR_CA_TELEPHONY("fr-CA_Telephony"),
    FR_FR_MULTIMEDIA("fr-FR_Multimedia"),
    FR_FR_TELEPHONY("fr-FR_Telephony"),
    HI_IN_TELEPHONY("hi-IN_Telephony"),
    IT_IT_MULTIMEDIA("it-IT_Multimedia"),
    IT_IT_TELEPHONY("it-IT_Telephony"),
    JA_JP_MULTIMEDIA("ja-JP_Multimedia"),
    JA_JP_TELEPHONY("ja-JP_Telephony"),
    KO_KR_MULTIMEDIA("ko-KR_Multimedia"),
    KO_KR_TELEPHONY("ko-KR_Telephony"),
    NL_BE_TELEPHONY("nl-BE_Telephony"),
    NL_NL_MULTIMEDIA("nl-NL_Multimedia"),
    NL_NL_TELEPHONY("nl-NL_Telephony"),
    PT_BR_MULTIMEDIA("pt-BR_Multimedia"),
    PT_BR_TELEPHONY("pt-BR_Telephony"),
    SV_SE_TELEPHONY("sv-SE_Telephony"),
    ZH_CN_TELEPHONY("zh-CN_Telephony");

    private final String id;

    SpeechModelId(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public boolean isNextGeneration() {
        return id.endsWith("_Multimedia") || id.endsWith("_Telephony");
    }

    public static Optional<SpeechModelId> fromId(String id) {
        return Arrays.stream(values())
                .filter(model -> model.id.equals(id))
                .findFirst();
    }
}
