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

import static org.pilens.pi.processing.persist.SqlText.bool;
import static org.pilens.pi.processing.persist.SqlText.jsonb;
import static org.pilens.pi.processing.persist.SqlText.literal;

import org.pilens.pi.conf.ConfigLoader;
import org.pilens.pi.om.InteractionRecord;
import org.pilens.pi.om.PackageInsert;
import org.pilens.pi.om.PiDocument;
import org.pilens.pi.om.WomenRiskAssessment;
import org.pilens.pi.om.WomenSection;
import org.pilens.pi.processing.extract.PiXmlExtractor;

/**
 * DDL and DML for the four target tables. Table names are configurable; index names are
 * derived from the unqualified table name so several schemas can coexist.
 */
public class PiSqlStatements {

	private final String rawdataTable;
	private final String interactionTable;
	private final String womenTable;
	private final String womenRiskTable;

	public PiSqlStatements(String rawdataTable, String interactionTable, String womenTable, String womenRiskTable) {
		this.rawdataTable = rawdataTable;
		this.interactionTable = interactionTable;
		this.womenTable = womenTable;
		this.womenRiskTable = womenRiskTable;
	}

	public static PiSqlStatements from(ConfigLoader cfg) {
		return new PiSqlStatements(cfg.getRawdataTable(), cfg.getInteractionTable(), cfg.getWomenTable(),
				cfg.getWomenRiskTable());
	}

	/** Unqualified table name: {@code public.sgml_women} becomes {@code sgml_women}. */
	static String baseName(String table) {
		int dot = table.lastIndexOf('.');
		return dot < 0 ? table : table.substring(dot + 1);
	}

	// ------------------------------------------------------------------- DDL

	/** DROP and CREATE for every table, dependents first. */
	public String schema() {
		String raw = baseName(rawdataTable);
		String inter = baseName(interactionTable);
		String women = baseName(womenTable);
		String risk = baseName(womenRiskTable);
		return """
				DROP TABLE IF EXISTS %1$s CASCADE;
				CREATE TABLE %1$s (
				  package_insert_no     text NOT NULL,
				  yj_code               text NOT NULL,
				  company_identifier    text,
				  prepared_ym           text,
				  brand_name_ja         text,
				  brand_name_hiragana   text,
				  trademark_en          text,
				  generic_name_ja       text,
				  standard_name_ja      text,
				  therapeutic_class_ja  text,
				  approval_no           text,
				  start_marketing       text,
				  storage_method        text,
				  shelf_life            text,
				  approval_etc_json     jsonb,
				  indications_json      jsonb,
				  info_dose_admin_json  jsonb,
				  interactions_json     jsonb,
				  adverse_reactions_json jsonb,
				  composition_json      jsonb,
				  property_json         jsonb,
				  interactions_flat     jsonb,
				  doc_xml               xml,
				  raw_xml_path          text,
				  updated_at            timestamptz DEFAULT now(),
				  CONSTRAINT %2$s_pkey PRIMARY KEY (package_insert_no, yj_code)
				);
				CREATE INDEX IF NOT EXISTS idx_%2$s_pkg_no ON %1$s (package_insert_no);
				CREATE INDEX IF NOT EXISTS idx_%2$s_yj ON %1$s (yj_code);
				CREATE INDEX IF NOT EXISTS idx_%2$s_inter_json_gin ON %1$s USING gin (interactions_json);
				CREATE INDEX IF NOT EXISTS idx_%2$s_inter_flat_gin ON %1$s USING gin (interactions_flat);

				DROP TABLE IF EXISTS %3$s CASCADE;
				CREATE TABLE %3$s (
				  id                    bigserial PRIMARY KEY,
				  package_insert_no     text NOT NULL,
				  yj_code               text NOT NULL,
				  section_type          text,
				  partner_group_ja      text,
				  partner_name_ja       text,
				  symptoms_measures_ja  text,
				  mechanism_ja          text,
				  created_at            timestamptz DEFAULT now()
				);
				CREATE INDEX idx_%4$s_yj ON %3$s (yj_code);
				CREATE INDEX idx_%4$s_pkg ON %3$s (package_insert_no);
				CREATE INDEX idx_%4$s_partner ON %3$s (partner_name_ja);

				DROP TABLE IF EXISTS %5$s CASCADE;
				CREATE TABLE %5$s (
				  package_insert_no     text NOT NULL,
				  yj_code               text NOT NULL,
				  brand_name_ja         text,
				  pregnant_text         text,
				  nursing_text          text,
				  has_pregnant          boolean,
				  has_nursing           boolean,
				  src_ids               jsonb,
				  pregnant_score        int,
				  pregnant_rule         text,
				  nursing_score         int,
				  nursing_rule          text,
				  overall_score         int,
				  pregnant_evidence     jsonb,
				  nursing_evidence      jsonb,
				  updated_at            timestamptz DEFAULT now(),
				  PRIMARY KEY (package_insert_no, yj_code)
				);
				CREATE EXTENSION IF NOT EXISTS pg_trgm;
				CREATE INDEX idx_%6$s_pregnant_trgm ON %5$s USING gin (pregnant_text gin_trgm_ops);
				CREATE INDEX idx_%6$s_nursing_trgm ON %5$s USING gin (nursing_text gin_trgm_ops);

				DROP TABLE IF EXISTS %7$s CASCADE;
				CREATE TABLE %7$s (
				  package_insert_no     text NOT NULL,
				  yj_code               text NOT NULL,
				  scheme                text NOT NULL,
				  pregnant_label        text,
				  nursing_label         text,
				  pregnant_score        int,
				  nursing_score         int,
				  evidence_json         jsonb,
				  updated_at            timestamptz DEFAULT now(),
				  PRIMARY KEY (package_insert_no, yj_code, scheme)
				);
				""".formatted(rawdataTable, raw, interactionTable, inter, womenTable, women, womenRiskTable, risk);
	}

	// ------------------------------------------------------------------- DML

	public String rawdataUpsert(PackageInsert row) {
		StringBuilder sql = new StringBuilder(1024);
		sql.append("INSERT INTO ").append(rawdataTable).append(" (package_insert_no, yj_code, company_identifier, prepared_ym, ")
				.append("brand_name_ja, brand_name_hiragana, trademark_en, generic_name_ja, standard_name_ja, ")
				.append("therapeutic_class_ja, approval_no, start_marketing, storage_method, shelf_life, ");
		for (String column : PiXmlExtractor.JSON_SECTIONS.keySet()) {
			sql.append(column).append(", ");
		}
		sql.append("interactions_flat, doc_xml, raw_xml_path, updated_at) VALUES (")
				.append(literal(row.getPackageInsertNo())).append(", ")
				.append(literal(row.getYjCode())).append(", ")
				.append(literal(row.getCompanyIdentifier())).append(", ")
				.append(literal(row.getPreparedYm())).append(", ")
				.append(literal(row.getBrandNameJa())).append(", ")
				.append(literal(row.getBrandNameHiragana())).append(", ")
				.append(literal(row.getTrademarkEn())).append(", ")
				.append(literal(row.getGenericNameJa())).append(", ")
				.append(literal(row.getStandardNameJa())).append(", ")
				.append(literal(row.getTherapeuticClassJa())).append(", ")
				.append(literal(row.getApprovalNo())).append(", ")
				.append(literal(row.getStartMarketing())).append(", ")
				.append(literal(row.getStorageMethod())).append(", ")
				.append(literal(row.getShelfLife())).append(", ");
		for (String column : PiXmlExtractor.JSON_SECTIONS.keySet()) {
			sql.append(jsonb(JsonColumns.toJson(row.getSections().get(column)))).append(", ");
		}
		sql.append(jsonb(JsonColumns.toJson(row.getInteractionsFlat()))).append(", ")
				.append(literal(row.getDocXml())).append(", ")
				.append(literal(row.getRawXmlPath())).append(", now())")
				.append(" ON CONFLICT (package_insert_no, yj_code) DO UPDATE SET ")
				.append("company_identifier = EXCLUDED.company_identifier, prepared_ym = EXCLUDED.prepared_ym, ")
				.append("brand_name_ja = EXCLUDED.brand_name_ja, brand_name_hiragana = EXCLUDED.brand_name_hiragana, ")
				.append("trademark_en = EXCLUDED.trademark_en, generic_name_ja = EXCLUDED.generic_name_ja, ")
				.append("standard_name_ja = EXCLUDED.standard_name_ja, therapeutic_class_ja = EXCLUDED.therapeutic_class_ja, ")
				.append("approval_no = EXCLUDED.approval_no, start_marketing = EXCLUDED.start_marketing, ")
				.append("storage_method = EXCLUDED.storage_method, shelf_life = EXCLUDED.shelf_life, ");
		for (String column : PiXmlExtractor.JSON_SECTIONS.keySet()) {
			sql.append(column).append(" = EXCLUDED.").append(column).append(", ");
		}
		sql.append("interactions_flat = EXCLUDED.interactions_flat, doc_xml = EXCLUDED.doc_xml, ")
				.append("raw_xml_path = EXCLUDED.raw_xml_path, updated_at = now();");
		return sql.toString();
	}

	/** Clears the interaction rows of one key so a re-imported insert replaces its set. */
	public String interactionDelete(String packageInsertNo, String yjCode) {
		return "DELETE FROM " + interactionTable + " WHERE package_insert_no = " + literal(packageInsertNo)
				+ " AND yj_code = " + literal(yjCode) + ";";
	}

	/** One insert per flattened record; null when the record carries nothing to store. */
	public String interactionInsert(String packageInsertNo, String yjCode, InteractionRecord r) {
		if (r == null || r.isEmpty()) return null;
		return "INSERT INTO " + interactionTable
				+ " (package_insert_no, yj_code, section_type, partner_group_ja, partner_name_ja, symptoms_measures_ja, mechanism_ja) VALUES ("
				+ literal(packageInsertNo) + ", "
				+ literal(yjCode) + ", "
				+ literal(r.category() == null ? null : r.category().label()) + ", "
				+ literal(r.group()) + ", "
				+ literal(r.partner()) + ", "
				+ literal(r.symptoms()) + ", "
				+ literal(r.mechanism()) + ");";
	}

	public String womenUpsert(PackageInsert row, PiDocument doc) {
		String preg = doc.section(WomenSection.PREGNANT).text();
		String nurs = doc.section(WomenSection.NURSING).text();
		WomenRiskAssessment risk = doc.getRisk();
		return "INSERT INTO " + womenTable
				+ " (package_insert_no, yj_code, brand_name_ja, pregnant_text, nursing_text, has_pregnant, has_nursing, src_ids,"
				+ " pregnant_score, pregnant_rule, nursing_score, nursing_rule, overall_score, pregnant_evidence, nursing_evidence) VALUES ("
				+ literal(row.getPackageInsertNo()) + ", "
				+ literal(row.getYjCode()) + ", "
				+ literal(row.getBrandNameJa()) + ", "
				+ literal(preg) + ", "
				+ literal(nurs) + ", "
				+ bool(preg != null && !preg.isEmpty()) + ", "
				+ bool(nurs != null && !nurs.isEmpty()) + ", "
				+ jsonb(JsonColumns.toJson(doc.sourceIds())) + ", "
				+ risk.getPregnant().score() + ", "
				+ literal(risk.getPregnant().ruleTag()) + ", "
				+ risk.getNursing().score() + ", "
				+ literal(risk.getNursing().ruleTag()) + ", "
				+ risk.getOverallScore() + ", "
				+ jsonb(JsonColumns.toJson(risk.getPregnantFlags())) + ", "
				+ jsonb(JsonColumns.toJson(risk.getNursingFlags())) + ")"
				+ " ON CONFLICT (package_insert_no, yj_code) DO UPDATE SET"
				+ " brand_name_ja = EXCLUDED.brand_name_ja, pregnant_text = EXCLUDED.pregnant_text,"
				+ " nursing_text = EXCLUDED.nursing_text, has_pregnant = EXCLUDED.has_pregnant,"
				+ " has_nursing = EXCLUDED.has_nursing, src_ids = EXCLUDED.src_ids,"
				+ " pregnant_score = EXCLUDED.pregnant_score, pregnant_rule = EXCLUDED.pregnant_rule,"
				+ " nursing_score = EXCLUDED.nursing_score, nursing_rule = EXCLUDED.nursing_rule,"
				+ " overall_score = EXCLUDED.overall_score, pregnant_evidence = EXCLUDED.pregnant_evidence,"
				+ " nursing_evidence = EXCLUDED.nursing_evidence, updated_at = now();";
	}

	public String womenRiskUpsert(PackageInsert row, WomenRiskAssessment risk) {
		return "INSERT INTO " + womenRiskTable
				+ " (package_insert_no, yj_code, scheme, pregnant_label, nursing_label, pregnant_score, nursing_score, evidence_json) VALUES ("
				+ literal(row.getPackageInsertNo()) + ", "
				+ literal(row.getYjCode()) + ", "
				+ literal(risk.getScheme()) + ", "
				+ literal(risk.getPregnantLabel()) + ", "
				+ literal(risk.getNursingLabel()) + ", "
				+ risk.getPregnant().score() + ", "
				+ risk.getNursing().score() + ", "
				+ jsonb(JsonColumns.toJson(risk.evidence())) + ")"
				+ " ON CONFLICT (package_insert_no, yj_code, scheme) DO UPDATE SET"
				+ " pregnant_label = EXCLUDED.pregnant_label, nursing_label = EXCLUDED.nursing_label,"
				+ " pregnant_score = EXCLUDED.pregnant_score, nursing_score = EXCLUDED.nursing_score,"
				+ " evidence_json = EXCLUDED.evidence_json, updated_at = now();";
	}
}
