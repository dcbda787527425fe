package org.pilens.pi.processing.persist;

/*
 * This file is part of PILens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * PILens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PILens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PILens.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.pilens.pi.conf.ConfigLoader;
import org.pilens.pi.om.ClassificationResult;
import org.pilens.pi.om.InteractionCategory;
import org.pilens.pi.om.InteractionRecord;
import org.pilens.pi.om.PackageInsert;
import org.pilens.pi.om.PiDocument;
import org.pilens.pi.om.SectionExtraction;
import org.pilens.pi.om.WomenRiskAssessment;
import org.pilens.pi.om.WomenSection;

class PiSqlStatementsTest {

	private final PiSqlStatements sql = new PiSqlStatements("public.raw", "public.inter", "women", "public.risk");

	private static PackageInsert row() {
		PackageInsert p = new PackageInsert();
		p.setPackageInsertNo("629000_1");
		p.setYjCode("6290001F1020");
		p.setBrandNameJa("サンプル錠");
		return p;
	}

	@Test
	void schema_uses_configured_names_and_unqualified_index_names() {
		String ddl = sql.schema();
		assertTrue(ddl.contains("CREATE TABLE public.raw ("));
		assertTrue(ddl.contains("CONSTRAINT raw_pkey PRIMARY KEY (package_insert_no, yj_code)"));
		assertTrue(ddl.contains("CREATE INDEX idx_inter_partner ON public.inter (partner_name_ja);"));
		assertTrue(ddl.contains("CREATE INDEX idx_women_pregnant_trgm ON women USING gin (pregnant_text gin_trgm_ops);"));
		assertTrue(ddl.contains("PRIMARY KEY (package_insert_no, yj_code, scheme)"));
	}

	@Test
	void table_names_come_from_config() {
		Properties p = new Properties();
		p.setProperty("WOMEN_RISK_TABLE", "staging.labels");
		PiSqlStatements s = PiSqlStatements.from(new ConfigLoader(p));
		assertTrue(s.schema().contains("CREATE TABLE staging.labels ("));
		assertTrue(s.schema().contains("CREATE TABLE public.sgml_rawdata ("));
		assertEquals("labels", PiSqlStatements.baseName("staging.labels"));
		assertEquals("plain", PiSqlStatements.baseName("plain"));
	}

	@Test
	void rawdata_upsert_escapes_text_and_nulls_missing_sections() {
		PackageInsert r = row();
		r.setTrademarkEn("O'Sample");
		r.getInteractionsFlat().add(new InteractionRecord("A", "G", null, null, InteractionCategory.CAUTION));

		String s = sql.rawdataUpsert(r);
		assertTrue(s.startsWith("INSERT INTO public.raw (package_insert_no, yj_code,"));
		assertTrue(s.contains("'O''Sample'"));
		assertTrue(s.contains("'[{\"partner\":\"A\",\"group\":\"G\",\"symptoms\":null,\"mechanism\":null,\"category\":\"併用注意\"}]'::jsonb"));
		assertTrue(s.contains("NULL, NULL, NULL, NULL, NULL, NULL, NULL"));
		assertTrue(s.endsWith("updated_at = now();"));
		assertTrue(s.contains("ON CONFLICT (package_insert_no, yj_code) DO UPDATE SET"));
	}

	@Test
	void interaction_insert_skips_empty_records() {
		assertNull(sql.interactionInsert("p", "y", new InteractionRecord(null, null, null, null, InteractionCategory.CAUTION)));
		assertNull(sql.interactionInsert("p", "y", null));

		String s = sql.interactionInsert("p", "", new InteractionRecord("イトラコナゾール", "CYP3A阻害剤", "QT延長", null,
				InteractionCategory.CONTRAINDICATED));
		assertEquals("INSERT INTO public.inter (package_insert_no, yj_code, section_type, partner_group_ja, partner_name_ja,"
				+ " symptoms_measures_ja, mechanism_ja) VALUES ('p', '', '併用禁忌', 'CYP3A阻害剤', 'イトラコナゾール', 'QT延長', NULL);", s);
	}

	@Test
	void interaction_delete_targets_one_key() {
		assertEquals("DELETE FROM public.inter WHERE package_insert_no = 'PI''1' AND yj_code = 'Y1';",
				sql.interactionDelete("PI'1", "Y1"));
	}

	@Test
	void women_upsert_carries_texts_flags_and_scores() {
		PiDocument doc = new PiDocument();
		doc.getWomenSections().put(WomenSection.PREGNANT, new SectionExtraction("投与しないこと", "p1"));
		WomenRiskAssessment risk = doc.getRisk();
		risk.setPregnant(new ClassificationResult(3, "contraindicated"));
		risk.getPregnantFlags().put("has_animal_terato", true);

		String s = sql.womenUpsert(row(), doc);
		assertTrue(s.contains("'投与しないこと', NULL, TRUE, FALSE, '{\"pregnant\":\"p1\"}'::jsonb, 3, 'contraindicated', 0, 'none', 3, "
				+ "'{\"has_animal_terato\":true}'::jsonb, '{}'::jsonb)"));
	}

	@Test
	void women_risk_upsert_is_keyed_by_scheme() {
		WomenRiskAssessment risk = new WomenRiskAssessment();
		risk.setScheme("toranomon");
		risk.setPregnantLabel("D/X");
		risk.setNursingLabel("不明");
		risk.setPregnant(new ClassificationResult(3, "contraindicated"));
		risk.setNursing(ClassificationResult.unclear());

		String s = sql.womenRiskUpsert(row(), risk);
		assertTrue(s.contains("VALUES ('629000_1', '6290001F1020', 'toranomon', 'D/X', '不明', 3, 0, "
				+ "'{\"pregnant_rule\":\"contraindicated\",\"nursing_rule\":\"unclear\",\"preg\":{\"confidence\":0},\"nurs\":{\"confidence\":0}}'::jsonb)"));
		assertTrue(s.contains("ON CONFLICT (package_insert_no, yj_code, scheme)"));
	}
}
